package warden.core.model;

/**
 * Result of starting an authorization-code flow.
 *
 * @param url   authorization URL the user must visit
 * @param state state value that the callback must present
 */
public record AuthFlowResult(String url, String state) {}
