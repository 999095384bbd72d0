package com.guno.salesintel.service;

import com.guno.salesintel.planner.VendorContext;

/**
 * Resolves the context of the requesting vendor. Never throws: on failure a minimal context
 * with just the name and timestamp comes back.
 */
public interface VendorContextResolver {

    VendorContext resolve(String vendorCompany);
}
