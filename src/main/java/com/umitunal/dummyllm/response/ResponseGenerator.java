package com.umitunal.dummyllm.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.model.JobRecord;
import com.umitunal.dummyllm.model.JobResult;
import com.umitunal.dummyllm.model.Usage;
import com.umitunal.dummyllm.serialization.JsonCodec;

/**
 * Produces the result payload for jobs that complete in state OK.
 */
public class ResponseGenerator {
    public static final String CHAT_OP = "llm.chat";

    private final ChatReplyGenerator chat;
    private final JsonCodec codec;

    public ResponseGenerator() {
        this(new ChatReplyGenerator(), new JsonCodec());
    }

    public ResponseGenerator(ChatReplyGenerator chat, JsonCodec codec) {
        this.chat = chat;
        this.codec = codec;
    }

    /**
     * Generate the result for a job.
     *
     * Echo jobs return the canonical form of {@code args.messages}; other jobs
     * get a chat reply when the op is {@value #CHAT_OP} and a generic
     * acknowledgement otherwise.
     */
    public JobResult generate(JobRecord record) {
        ObjectNode args = record.getArgs();
        JsonNode messages = args.path("messages");

        String text;
        if (record.getMode() == Mode.ECHO) {
            text = echo(messages);
        } else if (CHAT_OP.equals(record.getOp())) {
            text = chat.reply(lastUserMessage(messages), record.getSeed());
        } else {
            text = "ok :: op=" + record.getOp();
        }

        return new JobResult(text, new Usage(promptTokens(messages), TokenCounter.count(text)));
    }

    /**
     * Canonical serialization of the messages value, {@code []} when absent.
     */
    public String echo(JsonNode messages) {
        if (messages == null || messages.isMissingNode() || messages.isNull()) {
            return "[]";
        }
        return codec.canonical(messages);
    }

    /**
     * Content of the most recent message with role {@code user}, or empty.
     */
    static String lastUserMessage(JsonNode messages) {
        if (!messages.isArray()) {
            return "";
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode message = messages.get(i);
            if (message.isObject() && "user".equals(message.path("role").asText(null))) {
                JsonNode content = message.path("content");
                return content.isTextual() ? content.asText() : "";
            }
        }
        return "";
    }

    /**
     * Whitespace tokens across the text contents of all messages.
     */
    static int promptTokens(JsonNode messages) {
        if (!messages.isArray()) {
            return 0;
        }
        int total = 0;
        for (JsonNode message : messages) {
            JsonNode content = message.path("content");
            if (content.isTextual()) {
                total += TokenCounter.count(content.asText());
            }
        }
        return total;
    }
}
