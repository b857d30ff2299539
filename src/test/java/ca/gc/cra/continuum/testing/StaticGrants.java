package ca.gc.cra.continuum.testing;

import ca.gc.cra.continuum.application.port.LicenseBackendPort;
import ca.gc.cra.continuum.domain.license.LicenseGrant;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** License backend returning a replaceable grant and counting lookups. */
public final class StaticGrants implements LicenseBackendPort {
  private final AtomicReference<LicenseGrant> grant;
  private final AtomicInteger fetches = new AtomicInteger();

  public StaticGrants(LicenseGrant grant) {
    this.grant = new AtomicReference<>(grant);
  }

  @Override
  public LicenseGrant fetch(String licenseKey) throws IOException {
    fetches.incrementAndGet();
    return grant.get();
  }

  public void replace(LicenseGrant next) {
    grant.set(next);
  }

  public int fetches() {
    return fetches.get();
  }
}
