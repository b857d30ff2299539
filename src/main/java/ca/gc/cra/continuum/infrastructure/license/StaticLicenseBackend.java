package ca.gc.cra.continuum.infrastructure.license;

import ca.gc.cra.continuum.application.port.LicenseBackendPort;
import ca.gc.cra.continuum.domain.license.LicenseGrant;
import java.util.Objects;

/**
 * Serves a single grant declared in configuration ({@code license.id}, {@code license.expiry},
 * {@code license.quota}). Any non-blank key receives the configured grant; offline deployments use it.
 *
 * @since 0.1.0
 */
public final class StaticLicenseBackend implements LicenseBackendPort {
  private final LicenseGrant grant;

  public StaticLicenseBackend(LicenseGrant grant) {
    this.grant = Objects.requireNonNull(grant, "grant");
  }

  @Override
  public LicenseGrant fetch(String licenseKey) {
    return grant;
  }
}
