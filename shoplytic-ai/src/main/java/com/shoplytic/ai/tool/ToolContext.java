package com.shoplytic.ai.tool;

/**
 * What a tool needs to know about the turn it runs in.
 *
 * @param sessionId     owner of the cart, shipping details and orders touched by the tool
 * @param query         the query the handler was given, used when a search omits its own
 * @param minSimilarity retrieval threshold for this turn
 */
public record ToolContext(String sessionId, String query, double minSimilarity) {
}
