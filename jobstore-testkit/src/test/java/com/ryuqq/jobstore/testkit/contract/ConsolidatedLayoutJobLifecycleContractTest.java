package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.layout.CollectionLayout;

/**
 * Lifecycle scenarios with consolidated collections and without the job index.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class ConsolidatedLayoutJobLifecycleContractTest extends JobLifecycleContractTest {

    @Override
    protected JobStoreOptions options() {
        return super.options()
            .withCollectionLayout(CollectionLayout.CONSOLIDATED)
            .withJobIndexEnabled(false);
    }
}
