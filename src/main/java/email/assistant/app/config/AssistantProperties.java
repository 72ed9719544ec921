package email.assistant.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed pipeline tunables bound from {@code assistant.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    @Valid
    private Retrieval retrieval = new Retrieval();
    @Valid
    private Ranking ranking = new Ranking();
    @Valid
    private Review review = new Review();
    @Valid
    private Analysis analysis = new Analysis();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Capability capability = new Capability();
    @Valid
    private Sweep sweep = new Sweep();

    @Data
    public static class Retrieval {
        @Min(1)
        private int searchMaxResults = 60;
        @Min(1)
        private int passiveMaxResults = 25;
        @Min(1)
        private int maxTokens = 15;
        @NotBlank
        private String refineModel = "gpt-4o-mini";
        @Min(1)
        private int storedFallbackDays = 30;
        @Min(1)
        private int storedFallbackLimit = 250;
    }

    @Data
    public static class Ranking {
        @Min(1)
        private int passiveLimit = 12;
        @Min(1)
        private int searchLimit = 25;
        @DecimalMin("0.0")
        private double similarityWeight = 6.0;
    }

    @Data
    public static class Review {
        @Min(0)
        private int maxAttempts = 2;
        @NotBlank
        private String model = "gpt-4o";
        @Min(0)
        private int minModelPicks = 3;
        @Min(1)
        private int fallbackPicks = 8;
    }

    @Data
    public static class Analysis {
        @NotBlank
        private String model = "gpt-4o";
        @NotBlank
        private String contextModel = "gpt-4o-mini";
        @Min(1)
        private int maxAnalyze = 5;
        @Min(1)
        private int replyMaxAnalyze = 2;
        @Min(200)
        private int maxChars = 2000;
        @DecimalMin("0.0")
        private double minRelevance = 0.3;
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration responseTtl = Duration.ofHours(1);
        @Min(1)
        private int responseSoftCap = 100;
        @Min(1)
        private int bodyCacheSize = 500;
        @Min(1)
        private int embeddingFrontSize = 2000;
    }

    @Data
    public static class Capability {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Sweep {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofMinutes(1);
    }
}
