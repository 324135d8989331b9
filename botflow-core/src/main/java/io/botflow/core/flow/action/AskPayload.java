package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Question whose answer is stored in a variable and routed by validity.
///
/// @param questionText prompt sent to the user
/// @param varName variable receiving the answer
/// @param varType declared variable type
/// @param validation answer check; null until normalized
/// @param retryMessage message sent before re-asking after an invalid answer
/// @param answerTargetId target of `out:answer`, or null
/// @param invalidTargetId target of `out:invalid`, or null
public record AskPayload(
        String questionText,
        String varName,
        AskVarType varType,
        AskValidation validation,
        String retryMessage,
        String answerTargetId,
        String invalidTargetId)
        implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.ASK;
    }

    public AskPayload withAnswerTargetId(String target) {
        return new AskPayload(
                questionText, varName, varType, validation, retryMessage, target, invalidTargetId);
    }

    public AskPayload withInvalidTargetId(String target) {
        return new AskPayload(
                questionText, varName, varType, validation, retryMessage, answerTargetId, target);
    }
}
