package com.tracegroup.engine.connect;

import com.tracegroup.core.model.ContextType;
import com.tracegroup.engine.forest.EventForest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links producer and consumer events of the input data pipeline.
 *
 * Only contexts of the data-pipeline kind are connected. Nesting and grouping are not re-run,
 * so this can enrich an already grouped forest or be used on its own. Running it twice adds
 * no duplicate edges.
 */
public class DataPipelineConnector {

    private static final Logger log = LoggerFactory.getLogger(DataPipelineConnector.class);

    private final ContextType dataPipelineContext;
    private final ContextConnector contextConnector;

    public DataPipelineConnector(ContextType dataPipelineContext) {
        this(dataPipelineContext, new ContextConnector());
    }

    public DataPipelineConnector(ContextType dataPipelineContext, ContextConnector contextConnector) {
        this.dataPipelineContext = dataPipelineContext;
        this.contextConnector = contextConnector;
    }

    public int connect(EventForest forest) {
        int edges = contextConnector.connectOnly(forest, dataPipelineContext);
        log.debug("Connected {} data pipeline edges in trace {}", edges, forest.trace().name());
        return edges;
    }
}
