package io.llmcouncil.core;

import io.llmcouncil.core.conversation.ConversationRepository;
import io.llmcouncil.core.conversation.ConversationService;
import io.llmcouncil.core.conversation.CouncilConfigResolver;
import io.llmcouncil.core.conversation.InMemoryConversationRepository;
import io.llmcouncil.core.council.AggregateRanker;
import io.llmcouncil.core.council.ChairmanSynthesisStage;
import io.llmcouncil.core.council.CouncilOrchestrator;
import io.llmcouncil.core.council.IndependentGenerationStage;
import io.llmcouncil.core.council.PeerRankingStage;
import io.llmcouncil.core.council.RebuttalStage;
import io.llmcouncil.core.council.StageDispatcher;
import io.llmcouncil.core.gateway.DefaultModelGateway;
import io.llmcouncil.core.gateway.ModelClientFactory;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.gateway.spi.ModelProvider;
import io.llmcouncil.core.gateway.stub.StubModelProvider;
import io.llmcouncil.core.persona.CouncilMode;
import io.llmcouncil.core.persona.ModelPersonaResolver;
import io.llmcouncil.core.persona.PersonaResolver;
import io.llmcouncil.core.persona.PersonaResponseParser;
import io.llmcouncil.core.pricing.CostCalculator;
import io.llmcouncil.core.pricing.PriceTable;
import io.llmcouncil.core.ranking.ModelAssistedRankingExtractor;
import io.llmcouncil.core.ranking.RankingExtractor;
import io.llmcouncil.core.ranking.RegexRankingParser;
import io.llmcouncil.core.title.TitleGenerator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link CouncilEnvironment}s.
///
/// ### Usage Patterns
///
/// **Builder with explicit providers**:
/// {@snippet :
/// var env = CouncilFactory.builder()
///     .config(CouncilConfig.fromProperties(properties))
///     .credentials(CouncilFactory.loadCredentialsFromEnvironment())
///     .modelProvider(new LangChain4jModelProvider())
///     .personaResponseParser(new JacksonPersonaResponseParser())
///     .build();
/// }
///
/// **Quick start with environment variables**, providers discovered from the classpath:
/// {@snippet :
/// var env = CouncilFactory.createEnvironment();
/// }
///
/// ### Provider Discovery
/// Without explicit providers, {@link ModelProvider} implementations are loaded from
/// `META-INF/services/io.llmcouncil.core.gateway.spi.ModelProvider`. Explicit providers
/// replace discovery.
///
/// @see CouncilEnvironment
/// @see CouncilConfig
public final class CouncilFactory {

    private static final Logger logger = Logger.getLogger(CouncilFactory.class.getName());

    private static final String CREDENTIAL_PREFIX = "council.credentials.";

    private CouncilFactory() {}

    /// Creates an environment with default configuration, credentials from the environment
    /// and discovered providers.
    public static CouncilEnvironment createEnvironment() {
        return createEnvironment(CouncilConfig.defaults(), loadCredentialsFromEnvironment());
    }

    /// Creates an environment with discovered providers and the given credentials.
    ///
    /// @param config council configuration, not null
    /// @param credentials API keys and settings, not null (may be empty)
    /// @return wired environment, never null
    public static CouncilEnvironment createEnvironment(
            CouncilConfig config, Map<String, String> credentials) {
        return builder().config(config).credentials(credentials).build();
    }

    /// Discovers API credentials from environment variables.
    ///
    /// Matches `*_API_KEY`, `*_KEY`, `*_SECRET` and `*_TOKEN`, plus `COUNCIL_STUB_ENABLED`.
    ///
    /// @return discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null
                                    && !value.isEmpty()
                                    && (isApiKeyPattern(key)
                                            || StubModelProvider.ENABLED_KEY.equals(key))) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Loads credentials from properties.
    ///
    /// Supports prefixed keys (`council.credentials.OPENROUTER_API_KEY`, prefix stripped),
    /// direct API key names and the `council.stub.enabled` switch.
    ///
    /// @param properties source properties, not null
    /// @return credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(CREDENTIAL_PREFIX)) {
                        credentials.put(keyStr.substring(CREDENTIAL_PREFIX.length()), valueStr);
                    } else if (keyStr.equals(StubModelProvider.ENABLED_PROPERTY)
                            || isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });
        return credentials;
    }

    /// Loads credentials from the environment, overridden by properties.
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    static boolean isStubEnabled(Map<String, String> credentials) {
        return "true".equalsIgnoreCase(credentials.get(StubModelProvider.ENABLED_KEY))
                || "true".equalsIgnoreCase(credentials.get(StubModelProvider.ENABLED_PROPERTY));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /// Fluent builder for {@link CouncilEnvironment}.
    ///
    /// The built-in {@link StubModelProvider} is always registered; it only intercepts
    /// requests when stub mode is on.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private CouncilConfig config = CouncilConfig.defaults();
        private final Map<String, String> credentials = new HashMap<>();
        private final List<ModelProvider> providers = new ArrayList<>();
        private ModelGateway gateway;
        private ConversationRepository repository;
        private PersonaResponseParser personaResponseParser;
        private PriceTable priceTable = PriceTable.defaults();

        private Builder() {}

        public Builder config(CouncilConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Sets the OpenRouter API key used for `provider/model` ids.
        public Builder openRouterApiKey(String apiKey) {
            this.credentials.put("OPENROUTER_API_KEY", apiKey);
            return this;
        }

        public Builder modelProviders(List<ModelProvider> providers) {
            this.providers.clear();
            this.providers.addAll(providers);
            return this;
        }

        public Builder modelProvider(ModelProvider provider) {
            this.providers.add(provider);
            return this;
        }

        /// Routes every model to the stub provider.
        public Builder stubMode(boolean enabled) {
            this.credentials.put(StubModelProvider.ENABLED_PROPERTY, String.valueOf(enabled));
            return this;
        }

        /// Replaces the provider-backed gateway, e.g. with a scripted one in tests.
        public Builder gateway(ModelGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        /// Sets conversation storage; defaults to {@link InMemoryConversationRepository}.
        public Builder conversationRepository(ConversationRepository repository) {
            this.repository = repository;
            return this;
        }

        /// Sets the parser for specialist-mode persona replies. Without one, specialist
        /// conversations run without personas.
        public Builder personaResponseParser(PersonaResponseParser parser) {
            this.personaResponseParser = parser;
            return this;
        }

        public Builder priceTable(PriceTable priceTable) {
            this.priceTable = priceTable;
            return this;
        }

        /// Wires the environment.
        ///
        /// @return the environment, never null
        public CouncilEnvironment build() {
            ModelGateway modelGateway = gateway != null ? gateway : createGateway();

            ExecutorService stageExecutor =
                    Executors.newFixedThreadPool(
                            config.getPoolSize(), daemonThreads("council-stage"));
            ExecutorService titleExecutor =
                    Executors.newCachedThreadPool(daemonThreads("council-title"));

            CostCalculator costCalculator = new CostCalculator(priceTable);
            StageDispatcher dispatcher = new StageDispatcher(stageExecutor);
            RankingExtractor rankingExtractor =
                    new RankingExtractor(
                            new RegexRankingParser(),
                            new ModelAssistedRankingExtractor(
                                    modelGateway,
                                    config.getAuxiliaryModel(),
                                    config.getExtractionTimeout()));

            CouncilOrchestrator orchestrator =
                    new CouncilOrchestrator(
                            new IndependentGenerationStage(
                                    modelGateway, dispatcher, costCalculator, config),
                            new PeerRankingStage(
                                    modelGateway,
                                    dispatcher,
                                    costCalculator,
                                    rankingExtractor,
                                    config),
                            new AggregateRanker(),
                            new RebuttalStage(modelGateway, dispatcher, costCalculator, config),
                            new ChairmanSynthesisStage(modelGateway, costCalculator, config));

            ConversationRepository conversations =
                    repository != null ? repository : new InMemoryConversationRepository();
            ConversationService conversationService =
                    new ConversationService(
                            conversations,
                            orchestrator,
                            new CouncilConfigResolver(config, createPersonaResolver(modelGateway)),
                            new TitleGenerator(
                                    modelGateway,
                                    config.getAuxiliaryModel(),
                                    config.getTitleTimeout()),
                            costCalculator,
                            titleExecutor,
                            config.getTitleTimeout().plus(config.getDispatchGrace()));

            logger.info("Council environment ready: " + config);
            return new CouncilEnvironment(
                    config,
                    modelGateway,
                    orchestrator,
                    conversationService,
                    conversations,
                    costCalculator,
                    stageExecutor,
                    titleExecutor);
        }

        private ModelGateway createGateway() {
            List<ModelProvider> all =
                    new ArrayList<>(providers.isEmpty() ? discoverProviders() : providers);
            all.add(new StubModelProvider(isStubEnabled(credentials)));
            return new DefaultModelGateway(
                    new ModelClientFactory(credentials, all),
                    config.getStandardTimeout(),
                    config.getReasoningTimeout());
        }

        private static List<ModelProvider> discoverProviders() {
            List<ModelProvider> discovered = new ArrayList<>();
            for (ModelProvider provider : ServiceLoader.load(ModelProvider.class)) {
                discovered.add(provider);
                logger.fine("Discovered provider: " + provider.getName());
            }
            return discovered;
        }

        private PersonaResolver createPersonaResolver(ModelGateway modelGateway) {
            if (personaResponseParser != null) {
                return new ModelPersonaResolver(modelGateway, personaResponseParser);
            }
            return (mode, query, councilModels, chairmanModel) -> {
                if (mode == CouncilMode.SPECIALIST) {
                    logger.warning("No persona parser configured, running without personas");
                }
                return Map.of();
            };
        }
    }
}
