/**
 * Conversation runtime over a compiled scenario.
 *
 * <ul>
 *   <li>{@link com.crossbot.runtime.RuntimeTraversal} – selection → {@link com.crossbot.runtime.ScenarioReply}
 *       (messages, options, action, hand-off flag) and continuation after an action outcome</li>
 *   <li>{@link com.crossbot.runtime.session.AutoResponseTimers} – per-session delayed messages while a
 *       session waits for an operator</li>
 * </ul>
 */
package com.crossbot.runtime;
