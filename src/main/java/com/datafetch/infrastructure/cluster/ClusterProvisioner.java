package com.datafetch.infrastructure.cluster;

import com.datafetch.domain.model.WorkerSpec;

/**
 * Provisions a worker pool for a single job. Implementations own worker construction and
 * scheduling; callers only supply the logical worker spec and the initial worker count.
 */
public interface ClusterProvisioner {

    ProvisionedCluster provision(WorkerSpec spec, int initialWorkers);
}
