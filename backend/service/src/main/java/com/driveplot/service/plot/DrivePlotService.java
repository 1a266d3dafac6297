package com.driveplot.service.plot;

import com.driveplot.core.model.FetchTask;
import com.driveplot.core.time.TimeGrid;
import com.driveplot.engine.api.RoutingClient;
import com.driveplot.engine.assemble.AssembledResult;
import com.driveplot.engine.assemble.ResultAssembler;
import com.driveplot.engine.chart.TextChart;
import com.driveplot.engine.fetch.BatchFetchEngine;
import com.driveplot.engine.fetch.FetchReport;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.logging.Logger;

public class DrivePlotService {
    private static final Logger LOGGER = Logger.getLogger(DrivePlotService.class.getName());

    private final BatchFetchEngine engine;
    private final RoutingClient routingClient;
    private final ResultAssembler assembler;
    private final TextChart chart;

    public DrivePlotService(BatchFetchEngine engine, RoutingClient routingClient) {
        this(engine, routingClient, new ResultAssembler(), new TextChart());
    }

    public DrivePlotService(
            BatchFetchEngine engine,
            RoutingClient routingClient,
            ResultAssembler assembler,
            TextChart chart
    ) {
        this.engine = engine;
        this.routingClient = routingClient;
        this.assembler = assembler;
        this.chart = chart;
    }

    /**
     * @throws com.driveplot.core.time.InvalidRangeException when the window is empty
     * @throws com.driveplot.engine.assemble.EmptySeriesException when no departure has complete data
     */
    public DrivePlotResult plot(DrivePlotRequest request) {
        List<ZonedDateTime> grid = TimeGrid.build(
                request.date(),
                request.start(),
                request.end(),
                request.intervalMinutes(),
                request.zone()
        );
        List<FetchTask> tasks = FetchTask.forGrid(request.origin(), request.destination(), grid);
        LOGGER.info("Fetching " + tasks.size() + " queries for " + grid.size() + " departure times");

        FetchReport report = engine.run(tasks, routingClient);
        AssembledResult assembled = assembler.assemble(report.table());
        String rendered = chart.render(assembled.series(), assembled.insight(), request.intervalMinutes());
        return new DrivePlotResult(
                grid.size(),
                assembled.series(),
                assembled.insight(),
                rendered,
                report.failedCount(),
                report.roundsRun()
        );
    }
}
