package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.application.batch.BatchProbe;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import com.ryuqq.probe.testkit.contract.BatchProbeContract;

/**
 * SequentialBatchRunner에 대한 Batch Contract 바인딩.
 *
 * @author Probe Team
 * @since 1.0.0
 */
class SequentialBatchRunnerContractTest extends BatchProbeContract {

    @Override
    protected BatchProbe createBatchProbe(ProbeSessionFactory sessionFactory) {
        return new SequentialBatchRunner(sessionFactory);
    }
}
