package com.crossbot.service;

import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.tree.ScenarioAction;

/**
 * Outbound notification (mail, CSV export) requested by a MAIL or CSV node. Delivery is up to the
 * implementation.
 */
@FunctionalInterface
public interface NotificationTrigger {

    /**
     * @param config resolved configuration of the node ({@code MailConfig} or {@code CsvConfig})
     */
    void trigger(String definitionId, String sessionId, ScenarioAction action, ActionConfig config);
}
