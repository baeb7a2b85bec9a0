/**
 * Scenario engine entry points.
 * <ul>
 *   <li>{@link com.crossbot.service.ScenarioService}: import, recompile, export, runtime replies</li>
 *   <li>{@link com.crossbot.service.SessionStateSetter}, {@link com.crossbot.service.NotificationTrigger}: side effects owned by the host</li>
 *   <li>{@link com.crossbot.service.ScenarioBootstrap}: wiring from {@link com.crossbot.config.CrossbotConfig}</li>
 * </ul>
 */
package com.crossbot.service;
