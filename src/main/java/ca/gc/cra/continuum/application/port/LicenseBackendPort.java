package ca.gc.cra.continuum.application.port;

import ca.gc.cra.continuum.domain.license.LicenseGrant;
import java.io.IOException;

/**
 * Port to the entitlement service that resolves a license key into a {@link LicenseGrant}.
 *
 * @since 0.1.0
 */
public interface LicenseBackendPort {
  /**
   * Looks up the grant for a license key.
   *
   * @param licenseKey non-blank license key
   * @return current grant
   * @throws IOException when the backend cannot be reached or answers with an error
   */
  LicenseGrant fetch(String licenseKey) throws IOException;
}
