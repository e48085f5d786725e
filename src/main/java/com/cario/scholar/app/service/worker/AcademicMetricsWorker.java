package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.AcademicMetrics;
import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.service.client.OpenAlexClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/** Citation metrics for authors that carry a registry id. */
@Log4j2
public class AcademicMetricsWorker implements EnrichmentWorker {

  private final OpenAlexClient openAlex;
  private final ResilientCallExecutor executor;
  private final CredentialPool pool;

  public AcademicMetricsWorker(
      OpenAlexClient openAlex, ResilientCallExecutor executor, CredentialPool pool) {
    this.openAlex = openAlex;
    this.executor = executor;
    this.pool = pool;
  }

  @Override
  public String source() {
    return pool.getSource();
  }

  @Override
  public WorkerOutcome<EnrichmentFragment> enrich(RawRecord record, EnrichmentFragment current) {
    List<AuthorFragment> out = new ArrayList<>();
    for (AuthorFragment author : current.getAuthors().values()) {
      String orcidId = author.getRegistryId();
      if (orcidId == null) {
        continue;
      }
      WorkerOutcome<Optional<AcademicMetrics>> m =
          executor.call("openalex.author", pool, c -> openAlex.metricsForOrcid(orcidId));
      if (!m.isOk()) {
        return m.propagate();
      }
      m.orElse(Optional.empty())
          .ifPresent(
              metrics ->
                  out.add(AuthorFragment.builder().name(author.getName()).metrics(metrics).build()));
    }
    log.info("metrics.done id={} authors={}", record.getId(), out.size());
    return WorkerOutcome.ok(EnrichmentFragment.of(record.getId(), out));
  }
}
