package com.tracegroup.engine.heuristic;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;

/**
 * Marks ops and device kernels that ran eagerly, i.e. outside a graph executor.
 */
public class EagerExecutionMarker {

    private final HostEventType executorType;
    private final HostEventType eagerExecuteType;
    private final HostEventType opType;
    private final HostEventType kernelLaunchType;

    public EagerExecutionMarker(HostEventType executorType, HostEventType eagerExecuteType,
                                HostEventType opType, HostEventType kernelLaunchType) {
        this.executorType = executorType;
        this.eagerExecuteType = eagerExecuteType;
        this.opType = opType;
        this.kernelLaunchType = kernelLaunchType;
    }

    /**
     * A kernel launch is eager when it runs under an eager execute event and not under an
     * executor. The launch and the device kernels connected to it get the same flag.
     *
     * @return number of nodes flagged eager
     */
    public int markGpuKernels(EventForest forest) {
        int eagerCount = 0;
        for (EventNode launch : forest.nodesOfType(kernelLaunchType)) {
            boolean eager = forest.findParent(launch, executorType).isEmpty()
                && forest.findParent(launch, eagerExecuteType).isPresent();
            launch.setEager(eager);
            if (eager) {
                eagerCount++;
            }
            for (EventNode kernel : forest.childrenOf(launch)) {
                kernel.setEager(eager);
                if (eager) {
                    eagerCount++;
                }
            }
        }
        return eagerCount;
    }

    /**
     * An op is eager when no executor encloses it.
     *
     * @return number of ops flagged eager
     */
    public int markCpuOps(EventForest forest) {
        int eagerCount = 0;
        for (EventNode op : forest.nodesOfType(opType)) {
            boolean eager = forest.findParent(op, executorType).isEmpty();
            op.setEager(eager);
            if (eager) {
                eagerCount++;
            }
        }
        return eagerCount;
    }
}
