package com.umitunal.dummyllm.response;

import com.umitunal.dummyllm.selection.SplitMixDrawSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pattern-driven conversational replies in the style of ELIZA.
 *
 * Rules are tried in order and the first match wins. Among a rule's templates
 * the choice is keyed on the message content and the seed, never on how many
 * jobs ran before, so the same message and seed always get the same reply.
 */
public class ChatReplyGenerator {
    public static final String EMPTY_MESSAGE_REPLY = "Hello. What would you like to talk about?";

    private static final String TRIM_CHARS = " .!?";
    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final Map<String, String> REFLECTIONS = Map.of(
            "i", "you",
            "me", "you",
            "my", "your",
            "am", "are",
            "you", "I",
            "your", "my",
            "yours", "mine",
            "mine", "yours"
    );

    private final List<ReplyRule> rules;

    public ChatReplyGenerator() {
        this(defaultRules());
    }

    public ChatReplyGenerator(List<ReplyRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one reply rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Generate the reply for a user message.
     *
     * @param userMessage the most recent user message, may be null
     * @param seed the simulator seed
     */
    public String reply(String userMessage, long seed) {
        String message = userMessage == null ? "" : userMessage.strip();
        if (message.isEmpty()) {
            return EMPTY_MESSAGE_REPLY;
        }
        for (ReplyRule rule : rules) {
            var tail = rule.getMatcher().match(message);
            if (tail.isPresent()) {
                List<String> templates = rule.getTemplates();
                String template = templates.get(templateIndex(message, seed, templates.size()));
                String fragment = trim(tail.get());
                return template.replace("{x}", fragment.isEmpty() ? "that" : reflect(fragment));
            }
        }
        // Rule lists without a catch-all still answer
        return EMPTY_MESSAGE_REPLY;
    }

    public List<ReplyRule> getRules() {
        return rules;
    }

    /**
     * {@code hash(content, seed) mod count}: FNV-1a over the UTF-8 bytes, folded
     * with the seed through the SplitMix64 finalizer.
     */
    static int templateIndex(String content, long seed, int count) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : content.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        long mixed = SplitMixDrawSource.mix(hash ^ seed);
        return (int) Long.remainderUnsigned(mixed, count);
    }

    static String reflect(String text) {
        String[] words = text.split("\\s+");
        List<String> out = new ArrayList<>(words.length);
        for (String word : words) {
            out.add(REFLECTIONS.getOrDefault(word.toLowerCase(Locale.ROOT), word));
        }
        return String.join(" ", out);
    }

    private static String trim(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && TRIM_CHARS.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIM_CHARS.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * The built-in rule set. Order defines precedence; the last rule is the catch-all.
     */
    public static List<ReplyRule> defaultRules() {
        return List.of(
                ReplyRule.of(MessageMatcher.substring("i need"),
                        "Why do you need {x}?",
                        "Would it really help you to get {x}?",
                        "Are you sure you need {x}?"),
                ReplyRule.of(MessageMatcher.substring("i am"),
                        "How long have you been {x}?",
                        "How do you feel about being {x}?",
                        "Why do you say you're {x}?"),
                ReplyRule.of(MessageMatcher.substring("i feel"),
                        "Do you often feel {x}?",
                        "When do you usually feel {x}?",
                        "What makes you feel {x}?"),
                ReplyRule.of(MessageMatcher.keywords("because"),
                        "Is that the real reason?",
                        "What other reasons come to mind?",
                        "Does that reason apply to anything else?"),
                ReplyRule.of(MessageMatcher.keywords("why"),
                        "What do you think?",
                        "Why do you ask?",
                        "What answer would satisfy you?"),
                ReplyRule.of(MessageMatcher.keywords("hello", "hi", "hey"),
                        "Hello. How are you feeling today?",
                        "Hi. What's on your mind?"),
                ReplyRule.of(MessageMatcher.regex("\\bmother\\b"),
                        "Tell me more about your family.",
                        "How is your relationship with your mother?"),
                ReplyRule.of(MessageMatcher.regex("\\bfather\\b"),
                        "Tell me more about your family.",
                        "How is your relationship with your father?"),
                ReplyRule.of(MessageMatcher.keywords("always"),
                        "Can you think of a specific example?",
                        "When exactly does that happen?"),
                ReplyRule.of(MessageMatcher.always(),
                        "Please tell me more.",
                        "How does that make you feel?",
                        "Why do you say that?",
                        "Can you elaborate on that?",
                        "Let's explore that a bit further.")
        );
    }
}
