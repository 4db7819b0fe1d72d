package com.contextcatalog.engine.linkeddoc;

import com.contextcatalog.engine.concurrent.ConcurrencyLimiter;
import com.contextcatalog.engine.concurrent.TaskOutcome;
import com.contextcatalog.engine.fs.ContentReader;
import com.contextcatalog.engine.fs.RepoPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Follows Markdown links out of the located context files and summarizes the
 * documents they point at.
 *
 * <ol>
 *   <li>Extract links from each source in the given order (unreadable sources are skipped).</li>
 *   <li>Keep the first link per target across all sources.</li>
 *   <li>Cap at {@code maxDocs}; earlier sources win.</li>
 *   <li>Read and summarize the survivors with bounded concurrency.</li>
 * </ol>
 *
 * Documents and unresolved links are reported in link order regardless of
 * which summarization finishes first.
 */
@Component
public class LinkedDocumentResolver {

    private static final Logger log = LoggerFactory.getLogger(LinkedDocumentResolver.class);

    private final DocSummarizer summarizer;

    public LinkedDocumentResolver(DocSummarizer summarizer) {
        this.summarizer = summarizer;
    }

    /**
     * @param sourcePaths absolute paths of context files, shallowest first
     */
    public LinkedDocsResult discoverLinkedDocs(List<Path> sourcePaths, Path baseDir, DocDiscoveryOptions options) {
        Map<Path, ExtractedLink> unique = new LinkedHashMap<>();
        for (Path source : sourcePaths) {
            Optional<String> content = ContentReader.read(source);
            if (content.isEmpty()) {
                continue;
            }
            List<ExtractedLink> links = MarkdownLinkExtractor.extract(content.get(), source);
            if (!links.isEmpty()) {
                log.debug("Found {} link(s) in {}", links.size(), RepoPaths.relativize(baseDir, source));
            }
            links.forEach(link -> unique.putIfAbsent(link.absolutePath(), link));
        }

        int totalLinksFound = unique.size();
        List<ExtractedLink> toProcess = new ArrayList<>(unique.values());
        if (toProcess.size() > options.maxDocs()) {
            log.debug("Limiting to {} docs ({} skipped)", options.maxDocs(), totalLinksFound - options.maxDocs());
            toProcess = toProcess.subList(0, options.maxDocs());
        }
        if (toProcess.isEmpty()) {
            return new LinkedDocsResult(List.of(), totalLinksFound, List.of());
        }

        List<TaskOutcome<LinkOutcome>> outcomes = ConcurrencyLimiter.runWithConcurrencyLimit(
                toProcess, options.concurrency(), link -> process(link, baseDir, options));

        List<LinkedDocSummary> docs = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (TaskOutcome<LinkOutcome> outcome : outcomes) {
            if (!outcome.succeeded()) {
                continue;
            }
            LinkOutcome result = outcome.value();
            if (result.doc() != null) {
                docs.add(result.doc());
            } else {
                unresolved.add(result.unresolvedPath());
            }
        }

        log.debug("Summarized {} doc(s), {} unresolved", docs.size(), unresolved.size());
        return new LinkedDocsResult(docs, totalLinksFound, unresolved);
    }

    private LinkOutcome process(ExtractedLink link, Path baseDir, DocDiscoveryOptions options) {
        String relativePath = RepoPaths.relativize(baseDir, link.absolutePath());
        MDC.put("linkedDoc", relativePath);
        try {
            Optional<String> content = ContentReader.readWithLimit(link.absolutePath(), options.maxContentLength());
            if (content.isEmpty()) {
                log.debug("File not found: {}", link.rawPath());
                return LinkOutcome.unresolved(link.rawPath());
            }

            log.debug("Summarizing: {}", relativePath);
            String summary = summarizer.summarize(relativePath, content.get(),
                    options.provider(), options.timeout(), options.verbose());
            return LinkOutcome.resolved(new LinkedDocSummary(
                    relativePath, summary, RepoPaths.relativize(baseDir, link.sourcePath()), content.get()));
        } finally {
            MDC.remove("linkedDoc");
        }
    }

    private record LinkOutcome(LinkedDocSummary doc, String unresolvedPath) {

        static LinkOutcome resolved(LinkedDocSummary doc) {
            return new LinkOutcome(doc, null);
        }

        static LinkOutcome unresolved(String rawPath) {
            return new LinkOutcome(null, rawPath);
        }
    }
}
