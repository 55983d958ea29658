/**
 * Contract between a rollout and the environment it drives. The only shipped
 * implementation speaks MCP over HTTP, see {@code io.rolloutkit.mcp.McpEnvironment}.
 */
package io.rolloutkit.env;
