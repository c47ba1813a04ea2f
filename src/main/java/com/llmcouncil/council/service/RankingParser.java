package com.llmcouncil.council.service;

import static com.llmcouncil.council.CouncilConstants.LABEL_PREFIX;

import com.llmcouncil.council.model.LabelMapping;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the ordered list of labels out of a free-text peer review. Never throws: text that
 * yields nothing usable gives an empty list.
 *
 * <p>Looks, in order, at list entries after the last {@code FINAL RANKING} header, then at any
 * label mentioned after that header, then at any label mentioned anywhere. Labels missing from
 * the turn's mapping are dropped and a repeated label keeps its first position.
 */
@Service
public class RankingParser {

    private static final Pattern LABEL = Pattern.compile("\\bResponse\\s+([A-Z]{1,3})\\b");
    private static final Pattern HEADER = Pattern.compile("FINAL\\s+RANKING\\s*:?", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ENTRY = Pattern.compile(
            "^\\s*(?:\\d+\\s*[.):]|[-*•])\\s*(?:\\*\\*)?.*?\\bResponse\\s+([A-Z]{1,3})\\b",
            Pattern.MULTILINE);

    public List<String> parse(@Nullable String text, LabelMapping mapping) {
        if (!StringUtils.hasText(text) || mapping == null) {
            return List.of();
        }
        String section = sectionAfterLastHeader(text);
        if (section != null) {
            List<String> entries = collect(LIST_ENTRY.matcher(section), mapping);
            if (!entries.isEmpty()) {
                return entries;
            }
            List<String> mentions = collect(LABEL.matcher(section), mapping);
            if (!mentions.isEmpty()) {
                return mentions;
            }
        }
        return collect(LABEL.matcher(text), mapping);
    }

    @Nullable
    private String sectionAfterLastHeader(String text) {
        Matcher matcher = HEADER.matcher(text);
        int end = -1;
        while (matcher.find()) {
            end = matcher.end();
        }
        return end < 0 ? null : text.substring(end);
    }

    private List<String> collect(Matcher matcher, LabelMapping mapping) {
        Set<String> labels = new LinkedHashSet<>();
        while (matcher.find()) {
            String label = LABEL_PREFIX + matcher.group(1).toUpperCase(Locale.ROOT);
            if (mapping.containsLabel(label)) {
                labels.add(label);
            }
        }
        return List.copyOf(labels);
    }
}
