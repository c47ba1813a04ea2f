package com.llmcouncil.council.service;

import static com.llmcouncil.council.CouncilConstants.LABEL_PREFIX;

import com.llmcouncil.council.model.AnonymizedAnswer;
import com.llmcouncil.council.model.AnonymizedStage1;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.Stage1Answer;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class AnonymizationService {

    /**
     * Labels the answers in the order given. Callers pass the council-ordered Stage 1 list, so
     * the mapping depends only on council order and on which models succeeded.
     */
    public AnonymizedStage1 anonymize(List<Stage1Answer> answers) {
        Map<String, String> labelToModel = new LinkedHashMap<>();
        List<AnonymizedAnswer> anonymized = new ArrayList<>(answers.size());
        for (int index = 0; index < answers.size(); index++) {
            Stage1Answer answer = answers.get(index);
            String label = labelFor(index);
            labelToModel.put(label, answer.model());
            anonymized.add(new AnonymizedAnswer(label, answer.response()));
        }
        return new AnonymizedStage1(anonymized, new LabelMapping(labelToModel));
    }

    /**
     * {@code 0 -> "Response A"}, {@code 25 -> "Response Z"}, {@code 26 -> "Response AA"}.
     */
    public static String labelFor(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = index + 1;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            letters.append((char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return LABEL_PREFIX + letters.reverse();
    }

    /**
     * Replaces every whole-word occurrence of a label with the bolded short name of its model.
     * Text without labels comes back unchanged, and a second pass finds nothing to replace.
     */
    public String deAnonymize(String text, LabelMapping mapping) {
        if (!StringUtils.hasText(text) || mapping == null || mapping.size() == 0) {
            return text;
        }
        List<String> labels = new ArrayList<>(mapping.labels());
        // longest first so "Response AA" is never split into "Response A" + "A"
        labels.sort(Comparator.comparingInt(String::length).reversed());
        String alternation = labels.stream().map(Pattern::quote).reduce((a, b) -> a + "|" + b).orElseThrow();
        Pattern pattern = Pattern.compile("\\b(?:" + alternation + ")\\b");
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String model = mapping.modelFor(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement("**" + shortName(model) + "**"));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * {@code openai/gpt-5.2 -> gpt-5.2}; identifiers without a provider prefix are returned as-is.
     */
    public static String shortName(String model) {
        if (model == null) {
            return "";
        }
        int slash = model.indexOf('/');
        if (slash < 0 || slash == model.length() - 1) {
            return model;
        }
        return model.substring(slash + 1);
    }
}
