package ca.gc.cra.continuum.api;

import ca.gc.cra.continuum.application.license.LicenseStatusHolder;
import ca.gc.cra.continuum.application.port.DecisionEngineException;
import ca.gc.cra.continuum.application.store.RemoteEventWriter;
import ca.gc.cra.continuum.config.ContinuumRuntime;
import ca.gc.cra.continuum.domain.decision.Verdict;
import ca.gc.cra.continuum.domain.evidence.EvidenceRecord;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Caller-facing audit and feedback operations with JSON-ready responses.
 * <p><strong>Operations:</strong> service info, health, stats, metrics, license status, analyze, replay and
 * feedback.</p>
 * <p><strong>Errors:</strong> {@code InvalidRequestException}, {@code ServiceUnavailableException} and
 * {@code LicensePolicyException} propagate unchanged so a transport layer can map them to status codes.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent callers.</p>
 *
 * @since 0.1.0
 */
public final class GovernanceApi {
  static final String SERVICE_NAME = "Continuum API";

  private final ContinuumRuntime runtime;

  public GovernanceApi(ContinuumRuntime runtime) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  /**
   * Service identity.
   *
   * @return {@code {name, version, status}}
   */
  public Map<String, Object> root() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", SERVICE_NAME);
    map.put("version", EvidenceRecord.API_VERSION);
    map.put("status", "active");
    return map;
  }

  /**
   * Readiness summary. Never includes credentials.
   *
   * @return health map
   */
  public Map<String, Object> health() {
    LicenseStatusHolder holder = runtime.licenseGate().holder();
    RemoteEventWriter writer = runtime.writer();
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("status", holder.halted() ? "halted" : "healthy");
    map.put("engine_ready", runtime.analyze().engineReady());
    map.put("store_enabled", writer.enabled());
    map.put("store_kind", writer.kind());
    map.put("github_env_present", runtime.environment().githubPresent());
    map.put("github_repo_effective", runtime.environment().githubRepo());
    map.put("license_valid", holder.get().valid());
    map.put("halted", holder.halted());
    return map;
  }

  /**
   * Usage counters.
   *
   * @return stats map
   */
  public Map<String, Object> stats() {
    RemoteEventWriter writer = runtime.writer();
    Map<String, Object> map = new LinkedHashMap<>();
    Map<String, Object> snapshot = runtime.metrics().snapshot().toMap();
    map.put("total_analyses", snapshot.get("total_analyses"));
    map.put("decision_counts", snapshot.get("decision_counts"));
    map.put("feedback_count", runtime.feedback().feedbackCount());
    map.put("write_successes", writer.successes());
    map.put("write_failures", writer.failures());
    map.put("store_enabled", writer.enabled());
    map.put("store_kind", writer.kind());
    return map;
  }

  public Map<String, Object> metrics() {
    return runtime.metrics().snapshot().toMap();
  }

  /**
   * Current license status with enforcement state.
   *
   * @return status map plus {@code mode} and {@code halted}
   */
  public Map<String, Object> license() {
    LicenseStatusHolder holder = runtime.licenseGate().holder();
    LicenseStatus status = holder.get();
    Map<String, Object> map = status.toMap();
    map.put("mode", runtime.licenseGate().mode().name().toLowerCase(Locale.ROOT));
    map.put("halted", holder.halted());
    return map;
  }

  /**
   * Analyzes text through the configured Decision Engine.
   *
   * @param text request text
   * @return analyze response; never persisted
   * @throws DecisionEngineException when the engine cannot be reached
   */
  public Map<String, Object> analyze(String text) throws DecisionEngineException {
    return runtime.analyze().analyze(text).toResponseMap();
  }

  /**
   * Records a verdict captured elsewhere.
   *
   * @param text request text
   * @param verdict captured verdict
   * @return analyze response
   */
  public Map<String, Object> replay(String text, Verdict verdict) {
    return runtime.analyze().record(text, verdict).toResponseMap();
  }

  /**
   * Records feedback about an earlier analysis.
   *
   * @param logId analysis id
   * @param accuracy score 0..5
   * @param helpful score 0..5
   * @param accepted whether the output was accepted
   * @return {@code {status, feedback_id, write_status}}
   */
  public Map<String, Object> feedback(String logId, int accuracy, int helpful, boolean accepted) {
    return runtime.feedback().submit(logId, accuracy, helpful, accepted).toResponseMap();
  }
}
