package com.contextcatalog.engine.catalog;

import com.contextcatalog.engine.artifact.ArtifactLoadResult;
import com.contextcatalog.engine.artifact.ContextArtifactLocator;
import com.contextcatalog.engine.linkeddoc.DocDiscoveryOptions;
import com.contextcatalog.engine.linkeddoc.LinkedDocsResult;
import com.contextcatalog.engine.linkeddoc.LinkedDocumentResolver;
import com.contextcatalog.engine.provider.AiProvider;
import com.contextcatalog.engine.skill.SkillCatalog;
import com.contextcatalog.engine.skill.SkillCatalogBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Builds the {@link ContextCatalog} of one repository.
 *
 * Context files are located first; a failure there ({@code ScanException})
 * propagates because nothing else is meaningful without them. Skills and
 * linked documents follow. The linked-document stage needs an {@link AiProvider}
 * bean and is skipped without one; its failures are logged and leave that
 * section of the catalog empty.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final ContextArtifactLocator   locator;
    private final SkillCatalogBuilder      skillCatalogBuilder;
    private final LinkedDocumentResolver   linkedDocumentResolver;
    private final ObjectProvider<AiProvider> providers;

    private final int      linkedDocsMaxDocs;
    private final int      linkedDocsMaxContentLength;
    private final int      linkedDocsConcurrency;
    private final Duration linkedDocsTimeout;

    public CatalogService(
            ContextArtifactLocator locator,
            SkillCatalogBuilder skillCatalogBuilder,
            LinkedDocumentResolver linkedDocumentResolver,
            ObjectProvider<AiProvider> providers,
            @Value("${catalog.linked-docs.max-docs:30}") int linkedDocsMaxDocs,
            @Value("${catalog.linked-docs.max-content-length:8000}") int linkedDocsMaxContentLength,
            @Value("${catalog.linked-docs.concurrency:2}") int linkedDocsConcurrency,
            @Value("${catalog.linked-docs.timeout:60s}") Duration linkedDocsTimeout) {
        this.locator                    = locator;
        this.skillCatalogBuilder        = skillCatalogBuilder;
        this.linkedDocumentResolver     = linkedDocumentResolver;
        this.providers                  = providers;
        this.linkedDocsMaxDocs          = linkedDocsMaxDocs;
        this.linkedDocsMaxContentLength = linkedDocsMaxContentLength;
        this.linkedDocsConcurrency      = linkedDocsConcurrency;
        this.linkedDocsTimeout          = linkedDocsTimeout;
    }

    /**
     * @param maxDepth deepest directory level to include (root = 0); null for unlimited
     */
    public ContextCatalog build(Path baseDir, Integer maxDepth) {
        Path root = baseDir.toAbsolutePath().normalize();
        MDC.put("baseDir", root.toString());
        try {
            log.info("Building context catalog for {} (maxDepth={})", root, maxDepth == null ? "unlimited" : maxDepth);

            List<Path> contextFiles = locator.findContextFiles(root, maxDepth);
            SkillCatalog skills = skillCatalogBuilder.build(root, maxDepth);
            ArtifactLoadResult loaded = locator.loadArtifacts(contextFiles, root, locator.maxContentLength());
            LinkedDocsResult linkedDocs = discoverLinkedDocs(contextFiles, root);

            log.info("Catalog built: {} context file(s), {} skill(s) ({} duplicate(s) removed), {} linked doc(s)",
                    loaded.artifacts().size(), skills.uniqueCount(), skills.duplicatesRemoved(),
                    linkedDocs.docs().size());

            return new ContextCatalog(
                    root.toString(),
                    loaded.artifacts(),
                    skills.skills(),
                    skills.duplicatesRemoved(),
                    linkedDocs.docs(),
                    linkedDocs.totalLinksFound(),
                    linkedDocs.unresolvedLinks());
        } finally {
            MDC.remove("baseDir");
        }
    }

    private LinkedDocsResult discoverLinkedDocs(List<Path> contextFiles, Path root) {
        if (contextFiles.isEmpty()) {
            return LinkedDocsResult.empty();
        }
        AiProvider provider = providers.getIfAvailable();
        if (provider == null) {
            log.info("No AI provider configured, skipping linked documentation");
            return LinkedDocsResult.empty();
        }

        DocDiscoveryOptions options = DocDiscoveryOptions.defaults(provider)
                .withMaxDocs(linkedDocsMaxDocs)
                .withMaxContentLength(linkedDocsMaxContentLength)
                .withConcurrency(linkedDocsConcurrency)
                .withTimeout(linkedDocsTimeout)
                .withVerbose(log.isDebugEnabled());
        try {
            return linkedDocumentResolver.discoverLinkedDocs(contextFiles, root, options);
        } catch (RuntimeException e) {
            log.warn("Linked documentation discovery failed for {}: {}", root, e.getMessage(), e);
            return LinkedDocsResult.empty();
        }
    }
}
