package com.eainde.specmap.llm;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs latency and token usage of every model call.
 */
public class LoggingChatModelListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatModelListener.class);

    private static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
        log.debug("Sending {} message(s) to model", requestContext.chatRequest().messages().size());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object start = responseContext.attributes().get(START_TIME);
        long duration = start instanceof Long s ? System.currentTimeMillis() - s : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.debug("Model responded in {}ms, tokens in={} out={} total={}",
                    duration, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.debug("Model responded in {}ms", duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("Model call failed: {}", errorContext.error().getMessage());
    }
}
