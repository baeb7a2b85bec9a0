package com.crossbot.runtime;

import java.util.Objects;

/**
 * Fixed texts the runtime adds on its own: the welcome shown above several roots, the notice sent
 * when a hand-off node has no message, and the label of the synthetic return-to-start option.
 */
public final class RuntimeMessages {

    public static final String DEFAULT_WELCOME = "ご質問の種類をお選びください。";
    public static final String DEFAULT_HANDOVER_NOTICE = "担当者にお繋ぎします。ご質問内容を送信後、少々お待ちください。\n（日本語のみ対応可能です）";
    public static final String DEFAULT_RETURN_LABEL = "はじめに戻る";

    private final String welcomeMessage;
    private final String handoverNotice;
    private final String returnLabel;

    public RuntimeMessages(String welcomeMessage, String handoverNotice, String returnLabel) {
        this.welcomeMessage = Objects.requireNonNull(welcomeMessage, "welcomeMessage");
        this.handoverNotice = Objects.requireNonNull(handoverNotice, "handoverNotice");
        this.returnLabel = Objects.requireNonNull(returnLabel, "returnLabel");
    }

    public static RuntimeMessages defaults() {
        return new RuntimeMessages(DEFAULT_WELCOME, DEFAULT_HANDOVER_NOTICE, DEFAULT_RETURN_LABEL);
    }

    public String getWelcomeMessage() {
        return welcomeMessage;
    }

    public String getHandoverNotice() {
        return handoverNotice;
    }

    public String getReturnLabel() {
        return returnLabel;
    }
}
