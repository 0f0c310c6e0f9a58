package org.carball.autoindex.catalog;

import org.carball.autoindex.model.tenant.TenantFieldActivation;

import java.sql.SQLException;

/**
 * Which fields each tenant has enabled. Read only: the engine never changes it.
 */
public interface TenantFieldActivationSource {

    /**
     * @return the tenant's activation, or an empty activation for unknown tenants
     */
    TenantFieldActivation activationFor(String tenantId) throws SQLException;
}
