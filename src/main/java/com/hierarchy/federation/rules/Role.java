package com.hierarchy.federation.rules;

/**
 * Advisory role classes derived from a title. A title may carry both.
 */
public enum Role {
    LEADERSHIP,
    MANAGER
}
