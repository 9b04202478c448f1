package com.crewmind.core.tool;

/**
 * Response of one tool request as seen by the agent loop.
 *
 * @param toolId tool that was requested
 * @param output response text
 * @param cached true when served from the response cache without invoking the tool
 */
public record ToolCallResult(String toolId, String output, boolean cached) {
}
