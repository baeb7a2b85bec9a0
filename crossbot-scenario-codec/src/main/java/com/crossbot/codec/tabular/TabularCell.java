package com.crossbot.codec.tabular;

import com.crossbot.scenario.action.FormConfig;
import com.crossbot.scenario.action.LinkConfig;
import com.crossbot.scenario.compile.ClassifierVocabulary;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.ScenarioAction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One level cell of a tabular scenario: display text, the action its markers declare, and the marker
 * argument (link URL or form id).
 * <p>
 * Grammar, first match wins: {@code text[link]URL}; {@code [handover]} or the hand-off phrase;
 * {@code text[form]ID}; {@code [restart]}, the restart label or {@code HOME_BUTTON};
 * {@code [drop_off]}, {@code drop_off} or the drop-off label; otherwise plain text.
 */
final class TabularCell {

    static final String LINK_MARKER = "[link]";
    static final String HANDOVER_MARKER = "[handover]";
    static final String FORM_MARKER = "[form]";
    static final String RESTART_MARKER = "[restart]";
    static final String DROP_OFF_MARKER = "[drop_off]";
    static final String HOME_BUTTON = "HOME_BUTTON";
    static final String HOME_BUTTON_PRESSED = "HOME_BUTTON_PRESSED";

    private static final Pattern LINK = Pattern.compile("^(.+?)\\[link\\](.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FORM = Pattern.compile("^(.+?)\\[form\\](.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HANDOVER_TAG = Pattern.compile("\\[handover\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern RESTART_TAG = Pattern.compile("\\[restart\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern DROP_OFF_TAG = Pattern.compile("\\[drop_off\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern DROP_OFF_WORD = Pattern.compile("drop_off", Pattern.CASE_INSENSITIVE);

    private final String text;
    private final ScenarioAction action;
    private final String argument;

    TabularCell(String text, ScenarioAction action, String argument) {
        this.text = text;
        this.action = action;
        this.argument = argument;
    }

    String getText() {
        return text;
    }

    ScenarioAction getAction() {
        return action;
    }

    /** Link URL or form id; null for other actions. */
    String getArgument() {
        return argument;
    }

    static TabularCell parse(String raw, ClassifierVocabulary vocabulary) {
        String cell = raw.trim();

        Matcher link = LINK.matcher(cell);
        if (link.matches()) {
            return new TabularCell(link.group(1).trim(), ScenarioAction.LINK, link.group(2).trim());
        }
        if (HANDOVER_TAG.matcher(cell).find() || cell.contains(vocabulary.getHandoverPhrase())) {
            String text = HANDOVER_TAG.matcher(cell).replaceAll("").trim();
            return new TabularCell(text.isEmpty() ? vocabulary.getHandoverPhrase() : text, ScenarioAction.HANDOVER, null);
        }
        Matcher form = FORM.matcher(cell);
        if (form.matches()) {
            return new TabularCell(form.group(1).trim(), ScenarioAction.FORM, form.group(2).trim());
        }
        if (RESTART_TAG.matcher(cell).find() || cell.contains(vocabulary.getRestartLabel()) || cell.contains(HOME_BUTTON)) {
            String text = RESTART_TAG.matcher(cell).replaceAll("")
                    .replace(HOME_BUTTON_PRESSED, vocabulary.getRestartLabel())
                    .replace(HOME_BUTTON, vocabulary.getRestartLabel())
                    .trim();
            return new TabularCell(text.isEmpty() ? vocabulary.getRestartLabel() : text, ScenarioAction.RESTART, null);
        }
        String dropOff = vocabulary.getDropOffLabel();
        if (DROP_OFF_TAG.matcher(cell).find() || DROP_OFF_WORD.matcher(cell).find() || cell.contains(dropOff)) {
            String text = DROP_OFF_TAG.matcher(cell).replaceAll("");
            text = DROP_OFF_WORD.matcher(text).replaceAll("").replace(dropOff + ":", "").trim();
            return new TabularCell(text.isEmpty() ? dropOff : text, ScenarioAction.DROP_OFF, null);
        }
        return new TabularCell(cell, ScenarioAction.NONE, null);
    }

    /** Cell text for a node, with the marker that makes {@link #parse} read the same action back. */
    static String format(CompiledNode node, ClassifierVocabulary vocabulary) {
        String label = node.getTriggerLabel().isBlank() ? vocabulary.getDefaultNodeLabel() : node.getTriggerLabel();
        return switch (node.getAction()) {
            case LINK -> node.getActionConfig() instanceof LinkConfig c && c.getUrl() != null
                    ? label + LINK_MARKER + c.getUrl() : label;
            case HANDOVER -> label + HANDOVER_MARKER;
            case FORM -> node.getActionConfig() instanceof FormConfig c && c.getFormId() != null
                    ? label + FORM_MARKER + c.getFormId() : label;
            case RESTART -> label.contains(vocabulary.getRestartLabel()) ? label : label + RESTART_MARKER;
            case DROP_OFF -> label.contains(vocabulary.getDropOffLabel()) ? label : label + DROP_OFF_MARKER;
            default -> label;
        };
    }
}
