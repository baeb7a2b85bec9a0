package com.crossbot.scenario.compile;

import java.util.List;

/**
 * Phrases the classifier and the codecs recognise in authored text. Defaults are the product's
 * Japanese wording; deployments override them through configuration.
 */
public final class ClassifierVocabulary {

    public static final String DEFAULT_HANDOVER_KEYWORD = "オペレーター";
    public static final String DEFAULT_HANDOVER_PHRASE = "オペレーターにつなぐ";
    public static final String DEFAULT_RESTART_LABEL = "はじめに戻る";
    public static final String DEFAULT_RESTART_SENTINEL = "START";
    public static final String DEFAULT_OPTION_LABEL = "オプション";
    public static final String DEFAULT_NODE_LABEL = "ノード";
    public static final String DEFAULT_DROP_OFF_LABEL = "離脱";

    private static final ClassifierVocabulary DEFAULTS = builder().build();

    private final List<String> handoverKeywords;
    private final String handoverPhrase;
    private final String restartLabel;
    private final String restartSentinel;
    private final String defaultOptionLabel;
    private final String defaultNodeLabel;
    private final String dropOffLabel;

    private ClassifierVocabulary(Builder b) {
        this.handoverKeywords = List.copyOf(b.handoverKeywords);
        this.handoverPhrase = b.handoverPhrase;
        this.restartLabel = b.restartLabel;
        this.restartSentinel = b.restartSentinel;
        this.defaultOptionLabel = b.defaultOptionLabel;
        this.defaultNodeLabel = b.defaultNodeLabel;
        this.dropOffLabel = b.dropOffLabel;
    }

    public static ClassifierVocabulary defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Keywords that turn a button joint into a hand-off (substring match). */
    public List<String> getHandoverKeywords() {
        return handoverKeywords;
    }

    /** Full cell text that marks a hand-off row in tabular form. */
    public String getHandoverPhrase() {
        return handoverPhrase;
    }

    /** Label of the "return to start" choice. */
    public String getRestartLabel() {
        return restartLabel;
    }

    /** Jump target name that means "the scenario start". */
    public String getRestartSentinel() {
        return restartSentinel;
    }

    public String getDefaultOptionLabel() {
        return defaultOptionLabel;
    }

    public String getDefaultNodeLabel() {
        return defaultNodeLabel;
    }

    public String getDropOffLabel() {
        return dropOffLabel;
    }

    public boolean isHandoverText(String text) {
        if (text == null || text.isBlank()) return false;
        for (String keyword : handoverKeywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }

    public static final class Builder {
        private List<String> handoverKeywords = List.of(DEFAULT_HANDOVER_KEYWORD);
        private String handoverPhrase = DEFAULT_HANDOVER_PHRASE;
        private String restartLabel = DEFAULT_RESTART_LABEL;
        private String restartSentinel = DEFAULT_RESTART_SENTINEL;
        private String defaultOptionLabel = DEFAULT_OPTION_LABEL;
        private String defaultNodeLabel = DEFAULT_NODE_LABEL;
        private String dropOffLabel = DEFAULT_DROP_OFF_LABEL;

        public Builder handoverKeywords(List<String> handoverKeywords) {
            this.handoverKeywords = handoverKeywords != null && !handoverKeywords.isEmpty()
                    ? handoverKeywords : List.of(DEFAULT_HANDOVER_KEYWORD);
            return this;
        }

        public Builder handoverPhrase(String handoverPhrase) {
            this.handoverPhrase = handoverPhrase != null ? handoverPhrase : DEFAULT_HANDOVER_PHRASE;
            return this;
        }

        public Builder restartLabel(String restartLabel) {
            this.restartLabel = restartLabel != null ? restartLabel : DEFAULT_RESTART_LABEL;
            return this;
        }

        public Builder restartSentinel(String restartSentinel) {
            this.restartSentinel = restartSentinel != null ? restartSentinel : DEFAULT_RESTART_SENTINEL;
            return this;
        }

        public Builder defaultOptionLabel(String defaultOptionLabel) {
            this.defaultOptionLabel = defaultOptionLabel != null ? defaultOptionLabel : DEFAULT_OPTION_LABEL;
            return this;
        }

        public Builder defaultNodeLabel(String defaultNodeLabel) {
            this.defaultNodeLabel = defaultNodeLabel != null ? defaultNodeLabel : DEFAULT_NODE_LABEL;
            return this;
        }

        public Builder dropOffLabel(String dropOffLabel) {
            this.dropOffLabel = dropOffLabel != null ? dropOffLabel : DEFAULT_DROP_OFF_LABEL;
            return this;
        }

        public ClassifierVocabulary build() {
            return new ClassifierVocabulary(this);
        }
    }
}
