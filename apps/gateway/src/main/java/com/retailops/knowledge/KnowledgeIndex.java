package com.retailops.knowledge;

import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown docs split into citation-ready sections. Built once at startup and read-only after.
 *
 * <p>Section id: {@code doc:<FileStem>#section-<n>}; url:
 * {@code <citationRoot>/<slug>#section-<n>}.</p>
 */
@Component
@Slf4j
public class KnowledgeIndex {

    private static final Pattern HEADING = Pattern.compile("^\\s*#{1,6}\\s+\\S+");
    private static final Pattern HEADING_PREFIX = Pattern.compile("^\\s*#{1,6}\\s*");
    private static final Pattern TERM = Pattern.compile("[a-z0-9]+");

    // 文档名 -> URL slug 的特例
    private static final Map<String, String> SLUG_OVERRIDES = Map.of(
            "Returns_and_Holds_Policy", "returns",
            "Associate_Playbook", "associate-playbook",
            "Merch_Transfer_Playbook", "merch-transfer-playbook",
            "Support_Runbook", "support-runbook",
            "Styling_Guide_Spring_2026", "styling-guide-spring-2026"
    );

    private final GatewayProperties props;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final Map<String, KnowledgeSection> sections = new LinkedHashMap<>();

    public KnowledgeIndex(GatewayProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void load() throws IOException {
        String pattern = props.getKnowledge().getDocsPattern();
        Resource[] resources = resolver.getResources(pattern);
        Arrays.sort(resources, Comparator.comparing(r -> Objects.requireNonNullElse(r.getFilename(), "")));
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null || !filename.endsWith(".md")) continue;
            String text = resource.getContentAsString(StandardCharsets.UTF_8);
            for (KnowledgeSection section : parse(filename.substring(0, filename.length() - 3), text)) {
                sections.put(section.id(), section);
            }
        }
        log.info("[knowledge] pattern={} files={} sections={}", pattern, resources.length, sections.size());
    }

    /** Top sections by term frequency; full-phrase hits get a bonus. Ties broken by id. */
    public List<KnowledgeSection> search(String query, int limit) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<String> terms = new ArrayList<>();
        Matcher m = TERM.matcher(q);
        while (m.find()) terms.add(m.group());

        record Scored(int score, KnowledgeSection section) {}
        List<Scored> scored = new ArrayList<>();
        for (KnowledgeSection section : sections.values()) {
            String haystack = (section.title() + "\n" + section.content()).toLowerCase(Locale.ROOT);
            int score;
            if (terms.isEmpty()) {
                score = 1;
            } else {
                score = 0;
                for (String term : terms) score += count(haystack, term);
                if (!q.isBlank() && haystack.contains(q)) score += 2;
            }
            if (score > 0) scored.add(new Scored(score, section));
        }
        scored.sort(Comparator.comparingInt(Scored::score).reversed()
                .thenComparing(s -> s.section().id()));
        return scored.stream().limit(Math.max(1, limit)).map(Scored::section).toList();
    }

    public KnowledgeSection fetch(String id) {
        KnowledgeSection section = id == null ? null : sections.get(id.trim());
        if (section == null) {
            throw new GatewayException(ErrorKind.INVALID_ARGUMENTS, "Unknown document id '" + id + "'.",
                    "Use search to find a valid document id.");
        }
        return section;
    }

    public int size() {
        return sections.size();
    }

    List<KnowledgeSection> parse(String docStem, String text) {
        String[] lines = text.split("\\R", -1);
        List<Integer> headings = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (HEADING.matcher(lines[i]).find()) headings.add(i);
        }
        String slug = SLUG_OVERRIDES.getOrDefault(docStem, docStem.toLowerCase(Locale.ROOT).replace('_', '-'));
        String docTitle = docStem.replace('_', ' ');
        String root = props.getKnowledge().getCitationRoot();

        List<KnowledgeSection> out = new ArrayList<>();
        if (headings.isEmpty()) {
            out.add(new KnowledgeSection("doc:" + docStem + "#section-1", docTitle,
                    root + "/" + slug + "#section-1", text.strip()));
            return out;
        }
        for (int n = 0; n < headings.size(); n++) {
            int start = headings.get(n);
            int end = n + 1 < headings.size() ? headings.get(n + 1) : lines.length;
            String heading = HEADING_PREFIX.matcher(lines[start]).replaceFirst("").strip();
            String content = String.join("\n", Arrays.asList(lines).subList(start, end)).strip();
            int number = n + 1;
            out.add(new KnowledgeSection("doc:" + docStem + "#section-" + number, docTitle + ": " + heading,
                    root + "/" + slug + "#section-" + number, content));
        }
        return out;
    }

    private static int count(String haystack, String term) {
        int c = 0;
        for (int i = haystack.indexOf(term); i >= 0; i = haystack.indexOf(term, i + term.length())) c++;
        return c;
    }
}
