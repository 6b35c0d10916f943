package com.franchiseplatform.common.model;

/**
 * User's answer to a {@link ShadowAdvisorEvent}.
 *
 * <ul>
 *   <li>{@link #ENGAGE} raises the player's effective demand to the advisor's figure</li>
 *   <li>{@link #REPORT} rewards integrity with a better mood at some cost in agent trust</li>
 * </ul>
 */
public enum ShadowAdvisorAction {
    ENGAGE,
    REPORT
}
