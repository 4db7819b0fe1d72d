package com.contextcatalog.engine.catalog;

import com.contextcatalog.engine.artifact.ContextArtifactLocator;
import com.contextcatalog.engine.fs.RepositoryScanner;
import com.contextcatalog.engine.fs.ScanException;
import com.contextcatalog.engine.linkeddoc.DocSummarizer;
import com.contextcatalog.engine.linkeddoc.LinkedDocumentResolver;
import com.contextcatalog.engine.provider.AiProvider;
import com.contextcatalog.engine.provider.ProviderResponse;
import com.contextcatalog.engine.sandbox.IsolatedInvoker;
import com.contextcatalog.engine.skill.SkillCatalogBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end catalog builds over a temporary repository. Components are wired
 * by hand; only the AI provider is mocked.
 */
@ExtendWith(MockitoExtension.class)
class CatalogServiceTest {

    private static final String SKILL = """
            ---
            name: release
            description: Cuts a release branch and drafts notes
            ---
            """;

    @TempDir Path repo;
    @TempDir Path workDir;
    @Mock AiProvider provider;
    @Mock ObjectProvider<AiProvider> providers;

    CatalogService service;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        RepositoryScanner scanner = new RepositoryScanner();
        IsolatedInvoker invoker = new IsolatedInvoker(
                workDir.resolve("tmp/isolated-prompts").toString(), workDir.toString(), meterRegistry);
        service = new CatalogService(
                new ContextArtifactLocator(scanner, 50_000),
                new SkillCatalogBuilder(scanner),
                new LinkedDocumentResolver(new DocSummarizer(invoker, meterRegistry)),
                providers,
                30, 8000, 2, Duration.ofSeconds(60));
        lenient().when(provider.name()).thenReturn("fake");
    }

    @Test
    void build_fullRepository_allThreeCatalogs() throws IOException {
        write("AGENTS.md", "# Project\nSee [guide](docs/guide.md) and [gone](docs/gone.md).");
        write("CLAUDE.md", "@AGENTS.md");
        write(".github/copilot-instructions.md", "# Project\nSee [guide](docs/guide.md) and [gone](docs/gone.md).");
        write("packages/web/AGENTS.md", "# Web");
        write("docs/guide.md", "# Guide");
        write(".claude/skills/release/SKILL.md", SKILL);
        write(".agents/skills/release/SKILL.md", SKILL);
        when(providers.getIfAvailable()).thenReturn(provider);
        when(provider.invoke(anyString(), any())).thenReturn(ProviderResponse.of("Explains how to build and test."));

        ContextCatalog catalog = service.build(repo, null);

        assertThat(catalog.artifacts()).extracting(a -> a.path())
                .containsExactly("AGENTS.md", "packages/web/AGENTS.md");
        assertThat(catalog.agentsFileCount()).isEqualTo(2);
        assertThat(catalog.skillsCount()).isEqualTo(1);
        assertThat(catalog.skillsDuplicatesRemoved()).isEqualTo(1);
        assertThat(catalog.skills().get(0).duplicatePaths()).containsExactly(".claude/skills/release/SKILL.md");
        assertThat(catalog.linkedDocsCount()).isEqualTo(1);
        assertThat(catalog.linkedDocs().get(0).summary()).isEqualTo("Explains how to build and test.");
        assertThat(catalog.totalLinksFound()).isEqualTo(2);
        assertThat(catalog.unresolvedLinks()).containsExactly("docs/gone.md");
    }

    @Test
    void build_withoutProvider_skipsLinkedDocs() throws IOException {
        write("AGENTS.md", "[guide](docs/guide.md)");
        write("docs/guide.md", "# Guide");
        when(providers.getIfAvailable()).thenReturn(null);

        ContextCatalog catalog = service.build(repo, null);

        assertThat(catalog.artifacts()).hasSize(1);
        assertThat(catalog.linkedDocs()).isEmpty();
        verify(provider, never()).invoke(anyString(), any());
    }

    @Test
    void build_noContextFiles_emptyCatalog() {
        ContextCatalog catalog = service.build(repo, null);

        assertThat(catalog.artifacts()).isEmpty();
        assertThat(catalog.skills()).isEmpty();
        assertThat(catalog.linkedDocs()).isEmpty();
        verify(providers, never()).getIfAvailable();
    }

    @Test
    void build_missingRoot_propagatesScanException() {
        assertThatThrownBy(() -> service.build(repo.resolve("absent"), null)).isInstanceOf(ScanException.class);
    }

    @Test
    void build_maxDepth_appliesToFilesAndSkills() throws IOException {
        write("AGENTS.md", "# Root");
        write("a/b/AGENTS.md", "# Deep");
        write("SKILL.md", SKILL);
        write("tools/x/SKILL.md", SKILL.replace("release", "deploy"));
        when(providers.getIfAvailable()).thenReturn(null);

        ContextCatalog catalog = service.build(repo, 1);

        assertThat(catalog.artifacts()).extracting(a -> a.path()).containsExactly("AGENTS.md");
        assertThat(catalog.skills()).extracting(s -> s.name()).containsExactly("release");
    }

    @Test
    void json_omitsAbsentFieldsAndIncludesCounts() throws IOException {
        write("AGENTS.md", "# Root");
        write(".claude/rules/api.md", "---\nglobs: src/api/**\n---\n");
        write("SKILL.md", SKILL);
        when(providers.getIfAvailable()).thenReturn(null);

        JsonNode json = new ObjectMapper().valueToTree(service.build(repo, null));

        assertThat(json.get("agentsFileCount").asInt()).isEqualTo(2);
        assertThat(json.get("skillsCount").asInt()).isEqualTo(1);
        assertThat(json.get("linkedDocsCount").asInt()).isZero();
        assertThat(json.get("artifacts").get(0).get("type").asText()).isEqualTo("agents");
        assertThat(json.get("artifacts").get(0).has("globs")).isFalse();
        assertThat(json.get("artifacts").get(1).get("type").asText()).isEqualTo("rules");
        assertThat(json.get("artifacts").get(1).get("globs").asText()).isEqualTo("src/api/**");
        assertThat(json.get("skills").get(0).has("duplicatePaths")).isFalse();
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
