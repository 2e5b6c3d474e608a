package me.golemcore.palace.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * TF-IDF lexical index over node text.
 *
 * <p>
 * {@code documentFrequency[t]} always equals the number of node ids posted
 * under {@code termFrequency[t]}, and {@code totalDocuments} equals the number
 * of indexed nodes. Each node is indexed at most once; there is no removal.
 *
 * <p>
 * Not thread-safe.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class SearchIndex {

    public static final int SCHEMA_VERSION = 1;
    private static final int MIN_TERM_LENGTH = 3;
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s\\p{P}]+");

    private int schemaVersion = SCHEMA_VERSION;
    private Map<String, Map<String, Integer>> termFrequency = new HashMap<>();
    private Map<String, Integer> documentFrequency = new HashMap<>();
    private Map<String, Integer> nodeWordCounts = new HashMap<>();
    private int totalDocuments;

    /**
     * Indexes {@code title + content + summary} of a node.
     *
     * @return {@code false} if the node was already indexed, in which case the
     *         index is left untouched
     */
    public boolean indexNode(MemoryNode node) {
        if (node == null || node.getId() == null) {
            throw new IllegalArgumentException("Cannot index a node without id");
        }
        String nodeId = node.getId();
        if (nodeWordCounts.containsKey(nodeId)) {
            return false;
        }

        List<String> words = tokenize(String.join(" ",
                nullToEmpty(node.getTitle()), nullToEmpty(node.getContent()), nullToEmpty(node.getSummary())));
        nodeWordCounts.put(nodeId, words.size());
        totalDocuments++;

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String word : words) {
            counts.merge(word, 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            Map<String, Integer> postings = termFrequency.computeIfAbsent(entry.getKey(), k -> new HashMap<>());
            if (postings.put(nodeId, entry.getValue()) == null) {
                documentFrequency.merge(entry.getKey(), 1, Integer::sum);
            }
        }
        return true;
    }

    /**
     * {@code (count / nodeWordCount) * ln(totalDocuments / documentFrequency)}, or
     * 0 when the term does not occur in the node.
     */
    public double calculateTfIdf(String term, String nodeId) {
        Map<String, Integer> postings = termFrequency.get(term);
        if (postings == null) {
            return 0.0;
        }
        Integer count = postings.get(nodeId);
        Integer df = documentFrequency.get(term);
        Integer wordCount = nodeWordCounts.get(nodeId);
        if (count == null || df == null || wordCount == null || df <= 0 || wordCount <= 0
                || totalDocuments <= 0) {
            return 0.0;
        }

        double tf = (double) count / wordCount;
        double idf = Math.log((double) totalDocuments / df);
        return tf * idf;
    }

    /**
     * Node id to raw count for a term; empty when the term is unknown.
     */
    public Map<String, Integer> getPostings(String term) {
        Map<String, Integer> postings = termFrequency.get(term);
        return postings != null ? Collections.unmodifiableMap(postings) : Map.of();
    }

    public boolean isIndexed(String nodeId) {
        return nodeWordCounts.containsKey(nodeId);
    }

    public int getDocumentFrequency(String term) {
        return documentFrequency.getOrDefault(term, 0);
    }

    public int getWordCount(String nodeId) {
        return nodeWordCounts.getOrDefault(nodeId, 0);
    }

    public int getTotalDocuments() {
        return totalDocuments;
    }

    public int getTermCount() {
        return termFrequency.size();
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    /**
     * Checks that document frequencies agree with the postings, used to reject
     * corrupt snapshots.
     */
    public boolean isConsistent() {
        if (termFrequency == null || documentFrequency == null || nodeWordCounts == null) {
            return false;
        }
        if (totalDocuments != nodeWordCounts.size() || termFrequency.size() != documentFrequency.size()) {
            return false;
        }
        for (Map.Entry<String, Map<String, Integer>> entry : termFrequency.entrySet()) {
            Integer df = documentFrequency.get(entry.getKey());
            if (df == null || entry.getValue() == null || df != entry.getValue().size()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lowercases, splits on whitespace and punctuation and drops words shorter
     * than three characters.
     */
    public static List<String> tokenize(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return words;
        }
        for (String word : WORD_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (word.codePointCount(0, word.length()) >= MIN_TERM_LENGTH) {
                words.add(word);
            }
        }
        return words;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
