package com.example.datalake.mnemo.config;

import com.example.datalake.mnemo.search.KeywordMode;
import com.example.datalake.mnemo.vector.VectorMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds properties under {@code mnemo.*}:
 *
 * mnemo.embedding.provider=local
 * mnemo.vector.mode=auto
 * mnemo.keyword.mode=auto
 * mnemo.indexer.roots[0]=~/Projects
 * mnemo.context.min-confidence=0.5
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mnemo")
public class MnemoProperties {

    @Valid
    private Embedding embedding = new Embedding();

    @Valid
    private Vector vector = new Vector();

    @Valid
    private Keyword keyword = new Keyword();

    @Valid
    private Indexer indexer = new Indexer();

    @Valid
    private Context context = new Context();

    @Valid
    private Janitor janitor = new Janitor();

    @Data
    public static class Embedding {

        /**
         * "local" runs all-MiniLM-L6-v2 in process, "openai" calls the OpenAI embeddings API.
         */
        private String provider = "local";

        /**
         * Stored with every embedding row as provenance.
         */
        private String modelName = "all-MiniLM-L6-v2";

        @Min(1)
        private int dimension = 384;

        @Min(1)
        private int workerThreads = 2;

        /**
         * Temp directory name prefixes purged when the model runtime hits a full disk.
         */
        private List<String> cacheDirPrefixes = new ArrayList<>(List.of("onnxruntime-java"));

        /**
         * OpenAI API key, only read when provider is "openai".
         */
        private String apiKey;

        private String openAiModel = "text-embedding-3-small";
    }

    @Data
    public static class Vector {

        @NotNull
        private VectorMode mode = VectorMode.AUTO;

        /**
         * Candidates fetched per requested result before recency re-ranking.
         */
        @Min(1)
        private int overFetchFactor = 3;
    }

    @Data
    public static class Keyword {

        @NotNull
        private KeywordMode mode = KeywordMode.AUTO;
    }

    @Data
    public static class Indexer {

        private boolean enabled = true;

        private List<String> roots = new ArrayList<>(List.of("~/Projects", "~/Documents"));

        private List<String> extensions = new ArrayList<>(List.of(
                ".md", ".txt", ".py", ".js", ".ts", ".json", ".yaml", ".yml", ".toml", ".csv",
                ".html", ".css", ".sh", ".bash", ".zsh", ".rst", ".xml", ".ini", ".cfg", ".conf"));

        private List<String> skipDirs = new ArrayList<>(List.of(
                ".git", "node_modules", "__pycache__", ".venv", "venv", ".mypy_cache",
                ".pytest_cache", ".tox", "dist", "build", ".eggs", ".cache", ".idea", ".vscode"));

        private List<String> sensitivePatterns = new ArrayList<>(List.of(
                ".env", ".ssh", ".aws", ".gnupg", "credentials", "secrets"));

        @Min(1)
        private long maxFileBytes = 500L * 1024;

        @Min(1)
        private int chunkChars = 1500;

        @Min(0)
        private int overlapChars = 200;

        @Min(1)
        private int minChunkChars = 50;

        @Min(1)
        private int embedPrefixChars = 500;

        @Min(1)
        private int binaryProbeBytes = 8192;

        @NotNull
        private Duration mtimeTolerance = Duration.ofSeconds(1);

        private String cron = "0 0 3 * * *";
    }

    @Data
    public static class Context {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.5;

        @Min(0)
        private int factLimit = 5;

        @Min(0)
        private int goalLimit = 3;

        @Min(0)
        private int listItemLimit = 5;

        @Min(0)
        private int maxProjects = 3;

        @Min(1)
        private int readmeChars = 1500;

        /**
         * Fact category whose content names a project directory.
         */
        private String projectCategory = "project";
    }

    @Data
    public static class Janitor {

        private boolean enabled = true;

        private String cron = "0 30 4 * * *";

        /**
         * Embeddings younger than this are never swept, so a write still in flight keeps its row.
         */
        @NotNull
        private Duration grace = Duration.ofHours(1);
    }
}
