package rowset.engine.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import rowset.engine.aggregate.AggregateFunction;
import rowset.engine.aggregate.AggregateSpec;
import rowset.engine.aggregate.GroupByOptions;
import rowset.engine.aggregate.GroupByStage;
import rowset.engine.asof.AsOfJoinStage;
import rowset.engine.asof.AsOfOptions;
import rowset.engine.config.EngineOptions;
import rowset.engine.exec.FilterStage;
import rowset.engine.exec.Predicate;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;
import rowset.engine.fill.FillMethod;
import rowset.engine.fill.FillMissingStage;
import rowset.engine.join.JoinKey;
import rowset.engine.join.JoinOptions;
import rowset.engine.join.JoinStage;
import rowset.engine.numeric.NumericParser;
import rowset.engine.stats.ColumnStatistics;
import rowset.engine.stats.NormalizationMethod;
import rowset.engine.stats.NormalizeStage;
import rowset.engine.stats.StatisticsCalculator;
import rowset.engine.window.ResampleStage;
import rowset.engine.window.RollingStage;
import rowset.engine.window.WindowSpec;

/**
 * Lazy chain of stages over a RowSource. Appending stages does no work; every terminal
 * operation reads the source once, validates the chain and runs it.
 * <p>
 * A Pipeline is mutable and meant for a single owner.
 */
public class Pipeline {
    private final RowSource source;
    private final EngineOptions options;
    private final List<Stage> stages = new ArrayList<>();
    private final PipelineExecutor executor = new PipelineExecutor();
    private PipelineReport lastReport;

    private Pipeline(RowSource source, EngineOptions options) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
        this.options = options == null ? EngineOptions.defaults() : options;
    }

    public static Pipeline from(RowSource source) { return new Pipeline(source, EngineOptions.defaults()); }
    public static Pipeline from(RowSource source, EngineOptions options) { return new Pipeline(source, options); }
    public static Pipeline of(RowSet rows) { return from(new InMemorySource(rows)); }
    public static Pipeline of(RowSet rows, EngineOptions options) { return from(new InMemorySource(rows), options); }

    public Pipeline then(Stage stage) {
        if (stage == null) throw new IllegalArgumentException("stage must not be null");
        stages.add(stage);
        return this;
    }

    public Pipeline filter(Predicate predicate) { return then(new FilterStage(predicate)); }

    public Pipeline groupBy(List<String> keys, List<AggregateSpec> aggregates) {
        return then(new GroupByStage(keys, aggregates, GroupByOptions.DEFAULT.withSeparator(options.aggregateSeparator())));
    }

    public Pipeline groupBy(List<String> keys, List<AggregateSpec> aggregates, GroupByOptions groupOptions) {
        return then(new GroupByStage(keys, aggregates, groupOptions));
    }

    public Pipeline join(RowSet right, List<JoinKey> keys, JoinOptions joinOptions) {
        return then(new JoinStage(right, keys, joinOptions));
    }

    public Pipeline mergeAsOf(RowSet right, AsOfOptions asOfOptions) {
        return then(new AsOfJoinStage(right, asOfOptions));
    }

    public Pipeline resample(String timeColumn, List<String> targets, WindowSpec window, AggregateFunction function) {
        return then(new ResampleStage(timeColumn, targets, window, function));
    }

    public Pipeline rolling(int size, List<String> targets, AggregateFunction function) {
        return then(new RollingStage(size, targets, function));
    }

    public Pipeline rolling(int size, List<String> targets, AggregateFunction function, String suffix) {
        return then(new RollingStage(size, targets, function, suffix));
    }

    public Pipeline normalize(String column, NormalizationMethod method) {
        return then(new NormalizeStage(column, method));
    }

    public Pipeline normalize(String column, NormalizationMethod method, String outputColumn) {
        return then(new NormalizeStage(column, method, outputColumn));
    }

    public Pipeline normalize(List<String> columns, NormalizationMethod method) {
        return then(new NormalizeStage(columns, method));
    }

    public Pipeline normalize(List<String> columns, NormalizationMethod method, double rangeMin, double rangeMax) {
        return then(new NormalizeStage(columns, method, rangeMin, rangeMax));
    }

    public Pipeline fillMissing(List<String> columns, FillMethod method) {
        return then(new FillMissingStage(columns, method));
    }

    public Pipeline fillMissing(List<String> columns, String constant) {
        return then(new FillMissingStage(columns, FillMethod.CONSTANT, constant));
    }

    public List<Stage> stages() { return List.copyOf(stages); }
    public EngineOptions options() { return options; }

    /** Report of the most recent successful terminal operation, null before the first one. */
    public PipelineReport lastReport() { return lastReport; }

    public RowSet materialize() {
        return run("materialize").rows();
    }

    public Map<String, List<String>> toColumns() {
        return run("toColumns").rows().toColumns();
    }

    public void writeTo(RowSink sink) {
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        RowSet rows = run("writeTo").rows();
        try {
            sink.write(rows, options);
        } catch (RuntimeException e) {
            throw PipelineExecutor.wrap("writeTo", stages.size(), e);
        }
    }

    /** Describes one column of the final rows; failures in the calculation report stage index stages().size(). */
    public ColumnStatistics statistics(String column) {
        RowSet rows = run("statistics").rows();
        try {
            return StatisticsCalculator.describe(rows, column, new NumericParser(options.numericCulture()));
        } catch (RuntimeException e) {
            throw PipelineExecutor.wrap("statistics", stages.size(), e);
        }
    }

    private PipelineExecutor.Result run(String operation) {
        PipelineExecutor.Result result = executor.execute(operation, source, stages, options);
        lastReport = result.report();
        return result;
    }

    @Override
    public String toString() { return "Pipeline[" + source + " -> " + stages + "]"; }
}
