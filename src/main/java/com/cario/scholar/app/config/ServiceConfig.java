package com.cario.scholar.app.config;

import com.cario.scholar.app.repository.ProgressStore;
import com.cario.scholar.app.repository.dynamodb.DynamoDbProgressStore;
import com.cario.scholar.app.repository.file.FileProgressStore;
import com.cario.scholar.app.repository.jdbc.ScholarlyRecordRepository;
import com.cario.scholar.app.service.BatchOrchestrator;
import com.cario.scholar.app.service.CacheState;
import com.cario.scholar.app.service.FanoutCoordinator;
import com.cario.scholar.app.service.PromptLoaderService;
import com.cario.scholar.app.service.client.ArxivClient;
import com.cario.scholar.app.service.client.DocumentTextService;
import com.cario.scholar.app.service.client.LlmTextService;
import com.cario.scholar.app.service.client.OpenAlexClient;
import com.cario.scholar.app.service.client.OrcidClient;
import com.cario.scholar.app.service.client.TavilySearchClient;
import com.cario.scholar.app.service.matching.IdentityResolver;
import com.cario.scholar.app.service.matching.InstitutionDirectory;
import com.cario.scholar.app.service.worker.AcademicMetricsWorker;
import com.cario.scholar.app.service.worker.AffiliationExtractionWorker;
import com.cario.scholar.app.service.worker.CredentialPool;
import com.cario.scholar.app.service.worker.IdentityRegistryWorker;
import com.cario.scholar.app.service.worker.QuotaErrorClassifier;
import com.cario.scholar.app.service.worker.ResilientCallExecutor;
import com.cario.scholar.app.service.worker.WebRoleSearchWorker;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

@Log4j2
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties({
  EnrichmentProperties.class,
  SourcesProperties.class,
  ProgressProperties.class
})
public class ServiceConfig {

  private final EnrichmentProperties enrichment;
  private final SourcesProperties sources;
  private final ProgressProperties progress;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public CacheState cacheState() {
    return new CacheState(enrichment.getCache().getMaxNames(), enrichment.getCache().getRegistryTtl());
  }

  @Bean
  public PromptLoaderService promptLoaderService(
      ResourceLoader resourceLoader, ObjectProvider<S3Client> s3Client) {
    return new PromptLoaderService(resourceLoader, s3Client.getIfAvailable());
  }

  @Bean
  public ResilientCallExecutor resilientCallExecutor() {
    return new ResilientCallExecutor(
        enrichment.getRetry().getMaxAttempts(),
        enrichment.getRetry().getDelay(),
        new QuotaErrorClassifier());
  }

  // -------------------
  // Matching
  // -------------------

  @Bean
  public IdentityResolver identityResolver(CacheState cacheState) {
    return new IdentityResolver(
        enrichment.getMatching().getDirectoryThreshold(),
        enrichment.getMatching().getRoleThreshold(),
        cacheState);
  }

  @Bean
  public InstitutionDirectory institutionDirectory(
      ResourceLoader resourceLoader, IdentityResolver resolver, CacheState cacheState) {
    return InstitutionDirectory.fromCsv(
        resourceLoader.getResource(enrichment.getDirectoryLocation()), resolver, cacheState);
  }

  // -------------------
  // Credential pools
  // -------------------

  @Bean
  public CredentialPool documentPool() {
    return CredentialPool.unmetered("pdf");
  }

  @Bean
  public CredentialPool llmPool() {
    return CredentialPool.single("llm");
  }

  @Bean
  public CredentialPool orcidPool() {
    return CredentialPool.single("orcid");
  }

  @Bean
  public CredentialPool tavilyPool() {
    CredentialPool pool = new CredentialPool("tavily", sources.getTavily().getApiKeys());
    if (pool.size() == 0) {
      log.warn("config.tavily no api keys configured, web role search is disabled");
    }
    return pool;
  }

  @Bean
  public CredentialPool openAlexPool() {
    return CredentialPool.single("openalex");
  }

  // -------------------
  // External clients
  // -------------------

  @Bean
  public ArxivClient arxivClient(WebClient.Builder builder) {
    SourcesProperties.Arxiv a = sources.getArxiv();
    return new ArxivClient(
        builder, a.getBaseUrl(), a.getPageSize(), a.getIdBatchSize(), a.getPageDelay(), a.getMaxRetries());
  }

  @Bean
  public DocumentTextService documentTextService(WebClient.Builder builder) {
    return new DocumentTextService(
        builder, enrichment.getDocument().getMaxBytes(), enrichment.getDocument().getMaxChars());
  }

  @Bean
  public OrcidClient orcidClient(WebClient.Builder builder) {
    return new OrcidClient(builder, sources.getOrcid().getBaseUrl());
  }

  @Bean
  public TavilySearchClient tavilySearchClient(WebClient.Builder builder) {
    SourcesProperties.Tavily t = sources.getTavily();
    return new TavilySearchClient(builder, t.getBaseUrl(), t.getSearchDepth(), t.getMaxResults());
  }

  @Bean
  public OpenAlexClient openAlexClient(WebClient.Builder builder) {
    return new OpenAlexClient(
        builder, sources.getOpenalex().getBaseUrl(), sources.getOpenalex().getMailto());
  }

  // -------------------
  // Persistence
  // -------------------

  @Bean
  public ScholarlyRecordRepository scholarlyRecordRepository(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      InstitutionDirectory directory) {
    return new ScholarlyRecordRepository(jdbcTemplate, transactionManager, directory);
  }

  @Bean
  public ProgressStore progressStore(ObjectProvider<DynamoDbClient> dynamoDbClient) {
    if ("dynamodb".equalsIgnoreCase(progress.getBackend())) {
      DynamoDbClient ddb = dynamoDbClient.getIfAvailable();
      if (ddb == null) {
        throw new IllegalStateException("progress.backend=dynamodb requires aws.enabled=true");
      }
      log.info(
          "config.progress backend=dynamodb sessions={} items={}",
          progress.getSessionTable(),
          progress.getItemTable());
      return new DynamoDbProgressStore(ddb, progress.getSessionTable(), progress.getItemTable());
    }
    log.info("config.progress backend=file directory={}", progress.getDirectory());
    return new FileProgressStore(Path.of(progress.getDirectory()));
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public AffiliationExtractionWorker affiliationExtractionWorker(
      DocumentTextService documents,
      LlmTextService llm,
      PromptLoaderService prompts,
      ResilientCallExecutor executor,
      @Qualifier("documentPool") CredentialPool documentPool,
      @Qualifier("llmPool") CredentialPool llmPool) {
    return new AffiliationExtractionWorker(
        documents,
        llm,
        prompts,
        enrichment.getPrompts().getAffiliation(),
        executor,
        documentPool,
        llmPool);
  }

  @Bean
  public IdentityRegistryWorker identityRegistryWorker(
      OrcidClient orcid,
      IdentityResolver resolver,
      CacheState cacheState,
      ScholarlyRecordRepository repository,
      ResilientCallExecutor executor,
      @Qualifier("orcidPool") CredentialPool orcidPool) {
    EnrichmentProperties.Registry r = enrichment.getRegistry();
    return new IdentityRegistryWorker(
        orcid,
        resolver,
        cacheState,
        repository,
        executor,
        orcidPool,
        r.getSearchRows(),
        r.getExpandedRows(),
        r.getMaxCandidates());
  }

  @Bean
  public WebRoleSearchWorker webRoleSearchWorker(
      TavilySearchClient search,
      LlmTextService llm,
      PromptLoaderService prompts,
      ResilientCallExecutor executor,
      @Qualifier("tavilyPool") CredentialPool tavilyPool,
      @Qualifier("llmPool") CredentialPool llmPool) {
    return new WebRoleSearchWorker(
        search, llm, prompts, enrichment.getPrompts().getRole(), executor, tavilyPool, llmPool);
  }

  @Bean
  public AcademicMetricsWorker academicMetricsWorker(
      OpenAlexClient openAlex,
      ResilientCallExecutor executor,
      @Qualifier("openAlexPool") CredentialPool openAlexPool) {
    return new AcademicMetricsWorker(openAlex, executor, openAlexPool);
  }

  @Bean
  public FanoutCoordinator fanoutCoordinator(
      AffiliationExtractionWorker affiliation,
      IdentityRegistryWorker registry,
      WebRoleSearchWorker webRole,
      AcademicMetricsWorker metrics,
      @Qualifier("enrichmentExecutor") Executor enrichmentExecutor) {
    EnrichmentProperties.Concurrency c = enrichment.getConcurrency();
    return new FanoutCoordinator(
        affiliation,
        registry,
        webRole,
        metrics,
        enrichmentExecutor,
        c.getAffiliation(),
        c.getRegistry(),
        c.getWebRole(),
        c.getMetrics());
  }

  @Bean
  public BatchOrchestrator batchOrchestrator(
      ProgressStore progressStore,
      ArxivClient arxivClient,
      FanoutCoordinator fanout,
      ScholarlyRecordRepository repository,
      List<CredentialPool> pools) {
    return new BatchOrchestrator(
        progressStore, arxivClient, fanout, repository, pools, enrichment.getBatch().getSliceSize());
  }
}
