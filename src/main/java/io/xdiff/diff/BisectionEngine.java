package io.xdiff.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.xdiff.accessor.KeyBounds;
import io.xdiff.accessor.TableAccessor;
import io.xdiff.diff.DiffSummary.DiffStatus;
import io.xdiff.model.ColumnSpec;
import io.xdiff.model.KeyRange;
import io.xdiff.model.TableRef;
import io.xdiff.model.WorkItem;
import io.xdiff.partition.KeySpace;
import io.xdiff.partition.RangePartitioner;

/**
 * Drives a diff: validates both schemas, finds the key range to compare and then works through an
 * explicit queue of key ranges, shallowest first. Each range is compared by count and checksum on both
 * sides; matching ranges are done, small or one-sided mismatches are diffed row by row and large ones
 * are split and queued again one level deeper. Ranges at the maximum depth, and ranges that cannot be
 * split any further, are diffed row by row whatever their size.
 */
public class BisectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(BisectionEngine.class);

    private static final AtomicInteger runIdCounter = new AtomicInteger(0);

    private final TableAccessor leftAccessor;
    private final TableAccessor rightAccessor;
    private final DiffConfiguration config;

    public BisectionEngine(TableAccessor leftAccessor, TableAccessor rightAccessor, DiffConfiguration config) {
        this.leftAccessor = leftAccessor;
        this.rightAccessor = rightAccessor;
        this.config = config;
    }

    /**
     * Validates both tables and starts the run. Schema problems are reported here, before any range is
     * compared; everything after that surfaces through the returned stream.
     *
     * @throws SchemaMismatchException when a column is missing or the column types cannot be compared
     * @throws DiffRunException        when the schemas or key bounds cannot be read
     */
    public DiffStream diff(TableRef leftTable, TableRef rightTable) {
        DiffSummary summary = new DiffSummary();
        TableAccessor left = new ThrottledTableAccessor(leftAccessor, config.getLeftMaxQueries(), summary::leftQuery);
        TableAccessor right = new ThrottledTableAccessor(rightAccessor, config.getRightMaxQueries(),
                summary::rightQuery);
        Retryer retryer = new Retryer(config, summary);

        Map<String, ColumnSpec> leftSchema = retryer.call("describe left", null, () -> left.describe(leftTable));
        Map<String, ColumnSpec> rightSchema = retryer.call("describe right", null, () -> right.describe(rightTable));
        Pair<TableRef, TableRef> resolved = resolveColumns(leftTable, rightTable, leftSchema, rightSchema);
        TableRef resolvedLeft = resolved.getLeft();
        TableRef resolvedRight = resolved.getRight();
        logger.info("Comparing {} with {}", resolvedLeft, resolvedRight);

        KeySpace keySpace = KeySpace.forKeyColumns(leftTable.getKeyType(),
                Arrays.asList(leftSchema.get(leftTable.getKeyColumn()), rightSchema.get(rightTable.getKeyColumn())));
        Optional<KeyRange> root = rootRange(left, right, resolvedLeft, resolvedRight, keySpace, retryer);
        if (!root.isPresent()) {
            logger.info("No keys to compare, both tables are empty within the key bounds");
            summary.start();
            summary.finish(DiffStatus.SUCCEEDED);
            return DiffStream.empty(summary, resolvedLeft, resolvedRight);
        }

        DiffStream stream = new DiffStream(config.getStreamBufferSize(), summary, resolvedLeft, resolvedRight);
        Run run = new Run(root.get(), stream, summary,
                new RangePartitioner(keySpace), keySpace, left, right, resolvedLeft, resolvedRight, retryer);
        stream.onCancel(run::cancel);
        run.start();
        return stream;
    }

    Pair<TableRef, TableRef> resolveColumns(TableRef leftTable, TableRef rightTable,
                                            Map<String, ColumnSpec> leftSchema, Map<String, ColumnSpec> rightSchema) {
        List<String> problems = new ArrayList<>();
        if (leftTable.getKeyType() != rightTable.getKeyType()) {
            problems.add("key types differ: " + leftTable.getKeyType() + " and " + rightTable.getKeyType());
        }
        if (leftTable.getColumns().size() != rightTable.getColumns().size()) {
            problems.add("column counts differ: " + leftTable.getColumnNames() + " and "
                    + rightTable.getColumnNames());
            throw new SchemaMismatchException(problems);
        }

        checkKey(leftTable, leftSchema, problems);
        checkKey(rightTable, rightSchema, problems);

        List<ColumnSpec> leftResolved = new ArrayList<>();
        List<ColumnSpec> rightResolved = new ArrayList<>();
        for (int i = 0; i < leftTable.getColumns().size(); i++) {
            ColumnSpec l = lookup(leftTable, leftTable.getColumns().get(i), leftSchema, problems);
            ColumnSpec r = lookup(rightTable, rightTable.getColumns().get(i), rightSchema, problems);
            if (l == null || r == null) {
                continue;
            }
            if (!l.getType().isCompatibleWith(r.getType())) {
                problems.add("column " + l.getName() + " (" + l.getType() + ") cannot be compared with "
                        + r.getName() + " (" + r.getType() + ")");
                continue;
            }
            ColumnSpec common = l.commonWith(r);
            leftResolved.add(new ColumnSpec(leftTable.getColumns().get(i).getName(), common.getType(),
                    common.getScale(), common.getPrecision()));
            rightResolved.add(new ColumnSpec(rightTable.getColumns().get(i).getName(), common.getType(),
                    common.getScale(), common.getPrecision()));
        }
        if (!problems.isEmpty()) {
            throw new SchemaMismatchException(problems);
        }
        logger.debug("resolved columns {}", leftResolved);
        return Pair.of(leftTable.withColumns(leftResolved), rightTable.withColumns(rightResolved));
    }

    private static void checkKey(TableRef table, Map<String, ColumnSpec> schema, List<String> problems) {
        if (schema.isEmpty()) {
            return;
        }
        ColumnSpec key = schema.get(table.getKeyColumn());
        if (key == null) {
            problems.add(table.getSide().getName() + " key column " + table.getKeyColumn() + " not found in "
                    + table.getPath());
        } else if (!key.getType().isCompatibleWith(table.getKeySpec().getType())) {
            problems.add(table.getSide().getName() + " key column " + table.getKeyColumn() + " is "
                    + key.getType() + ", not " + table.getKeyType());
        }
    }

    // an empty schema means the backend cannot tell; the configured column stands
    private static ColumnSpec lookup(TableRef table, ColumnSpec configured, Map<String, ColumnSpec> schema,
                                     List<String> problems) {
        if (schema.isEmpty()) {
            return configured;
        }
        ColumnSpec found = schema.get(configured.getName());
        if (found == null) {
            problems.add(table.getSide().getName() + " column " + configured.getName() + " not found in "
                    + table.getPath());
        }
        return found;
    }

    Optional<KeyRange> rootRange(TableAccessor left, TableAccessor right, TableRef leftTable, TableRef rightTable,
                                 KeySpace keySpace, Retryer retryer) {
        Object minKey = config.getMinKey() == null ? null : keySpace.coerce(config.getMinKey());
        Object maxKey = config.getMaxKey() == null ? null : keySpace.coerce(config.getMaxKey());
        if (minKey != null && maxKey != null && keySpace.compare(minKey, maxKey) >= 0) {
            throw new IllegalArgumentException("minKey " + minKey + " must be below maxKey " + maxKey);
        }

        Optional<KeyBounds> lb = retryer.call("left bounds", null, () -> left.bounds(leftTable));
        Optional<KeyBounds> rb = retryer.call("right bounds", null, () -> right.bounds(rightTable));
        logger.info("key bounds: left {}, right {}", lb.map(Object::toString).orElse("empty"),
                rb.map(Object::toString).orElse("empty"));
        if (!lb.isPresent() && !rb.isPresent()) {
            return Optional.empty();
        }
        Object min;
        Object max;
        if (!lb.isPresent()) {
            min = rb.get().getMin();
            max = rb.get().getMax();
        } else if (!rb.isPresent()) {
            min = lb.get().getMin();
            max = lb.get().getMax();
        } else {
            min = keySpace.min(lb.get().getMin(), rb.get().getMin());
            max = keySpace.max(lb.get().getMax(), rb.get().getMax());
        }
        if (minKey != null) {
            min = minKey;
        }
        if (maxKey != null) {
            if (keySpace.compare(min, maxKey) >= 0) {
                return Optional.empty();
            }
            return Optional.of(KeyRange.bounded(min, maxKey, keySpace));
        }
        if (keySpace.compare(min, max) > 0) {
            return Optional.empty();
        }
        return Optional.of(KeyRange.unbounded(min, max, keySpace));
    }

    private class Run implements Runnable {

        private final KeyRange root;
        private final DiffStream stream;
        private final DiffSummary summary;
        private final RangePartitioner partitioner;
        private final SegmentComparator comparator;
        private final ExactRowDiffer differ;

        private final ThreadPoolExecutor workers;
        private final ExecutorService queryPool;
        private final ScheduledExecutorService statusReporter;
        private final Thread coordinator;
        private volatile boolean cancelled;

        Run(KeyRange root, DiffStream stream, DiffSummary summary, RangePartitioner partitioner, KeySpace keySpace,
            TableAccessor left, TableAccessor right, TableRef leftTable, TableRef rightTable, Retryer retryer) {
            this.root = root;
            this.stream = stream;
            this.summary = summary;
            this.partitioner = partitioner;
            int runId = runIdCounter.incrementAndGet();

            int numThreads = config.getThreads();
            workers = new ThreadPoolExecutor(numThreads, numThreads, 30, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    new ThreadFactoryBuilder().setNameFormat("DiffWorker-%d").setDaemon(true).build());
            queryPool = Executors.newCachedThreadPool(
                    new ThreadFactoryBuilder().setNameFormat("QueryPool-%d").setDaemon(true).build());
            if (config.getStatusIntervalSeconds() > 0) {
                statusReporter = Executors.newSingleThreadScheduledExecutor(
                        new ThreadFactoryBuilder().setNameFormat("DiffStatus-" + runId).setDaemon(true).build());
            } else {
                statusReporter = null;
            }
            comparator = new SegmentComparator(left, right, leftTable, rightTable, config.getExactDiffThreshold(),
                    retryer, queryPool);
            differ = new ExactRowDiffer(left, right, leftTable, rightTable, keySpace, retryer);
            coordinator = new Thread(this, "DiffCoordinator-" + runId);
            coordinator.setDaemon(true);
        }

        void start() {
            summary.start();
            if (statusReporter != null) {
                statusReporter.scheduleAtFixedRate(summary::logStatus, config.getStatusIntervalSeconds(),
                        config.getStatusIntervalSeconds(), TimeUnit.SECONDS);
            }
            coordinator.start();
        }

        void cancel() {
            if (summary.getStatus() != DiffStatus.RUNNING) {
                return;
            }
            cancelled = true;
            logger.info("cancelling diff, {} work items queued or running", workers.getActiveCount());
            workers.shutdownNow();
            queryPool.shutdownNow();
            coordinator.interrupt();
        }

        @Override
        public void run() {
            logger.info("[Main] starting diff over {}, {}", root, config);
            CompletionService<List<WorkItem>> completion = new ExecutorCompletionService<>(workers);
            PriorityQueue<WorkItem> pending = new PriorityQueue<>();
            pending.add(new WorkItem(root, 0));
            int inFlight = 0;
            DiffRunException fatal = null;
            try {
                while (!cancelled && (!pending.isEmpty() || inFlight > 0)) {
                    while (!cancelled && inFlight < config.getThreads() && !pending.isEmpty()) {
                        WorkItem item = pending.poll();
                        completion.submit(() -> process(item));
                        inFlight++;
                    }
                    Future<List<WorkItem>> done = completion.take();
                    inFlight--;
                    try {
                        pending.addAll(done.get());
                    } catch (ExecutionException e) {
                        if (cancelled) {
                            continue;
                        }
                        Throwable cause = e.getCause();
                        DiffRunException failure = cause instanceof DiffRunException ? (DiffRunException) cause
                                : new DiffRunException("diff", null, cause);
                        if (config.isSkipFailedRanges()) {
                            summary.segmentFailed();
                            logger.error("[Main] skipping failed range: {}", failure.getMessage(), failure);
                        } else {
                            fatal = failure;
                            break;
                        }
                    }
                }
            } catch (RejectedExecutionException e) {
                if (!cancelled) {
                    fatal = new DiffRunException("diff", null, e);
                }
            } catch (InterruptedException e) {
                if (!cancelled) {
                    fatal = new DiffRunException("diff", null, e);
                }
            } catch (RuntimeException e) {
                if (!cancelled) {
                    fatal = new DiffRunException("diff", null, e);
                }
            } finally {
                workers.shutdownNow();
                queryPool.shutdownNow();
                if (statusReporter != null) {
                    statusReporter.shutdownNow();
                }
            }

            if (fatal != null) {
                summary.finish(DiffStatus.FAILED);
                logger.error("[Main] diff failed: {}", fatal.getMessage(), fatal);
                stream.fail(fatal);
            } else if (cancelled) {
                summary.finish(DiffStatus.CANCELLED);
            } else {
                summary.finish(DiffStatus.SUCCEEDED);
                stream.complete();
            }
            logger.info(summary.getSummary(true));
        }

        private List<WorkItem> process(WorkItem item) {
            KeyRange range = item.getRange();
            try {
                SegmentComparison comparison = comparator.compare(range);
                summary.segmentCompared(comparison, item.getDepth());
                switch (comparison.getClassification()) {
                    case MATCH:
                        logger.debug("{} matches at depth {}", range, item.getDepth());
                        return Collections.emptyList();
                    case SMALL_MISMATCH:
                        exactDiff(range, true, true);
                        return Collections.emptyList();
                    case ONE_SIDED:
                        exactDiff(range, !comparison.getLeft().isEmpty(), !comparison.getRight().isEmpty());
                        return Collections.emptyList();
                    default:
                        if (item.getDepth() >= config.getMaxDepth()) {
                            logger.debug("{} at max depth {}, diffing rows", range, item.getDepth());
                            exactDiff(range, true, true);
                            return Collections.emptyList();
                        }
                        List<KeyRange> children = partitioner.split(range, config.getBisectionFactor());
                        if (partitioner.isMaximallyBisected(children)) {
                            logger.debug("{} cannot be split, diffing rows", range);
                            exactDiff(range, true, true);
                            return Collections.emptyList();
                        }
                        summary.segmentSplit();
                        logger.debug("{} split into {} at depth {}", comparison, children.size(),
                                item.getDepth() + 1);
                        return children.stream().map(item::child).collect(Collectors.toList());
                }
            } catch (DiffRunException | CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DiffRunException("compare", range, e);
            }
        }

        private void exactDiff(KeyRange range, boolean readLeft, boolean readRight) {
            ExactRowDiffer.Result result = differ.diff(range, readLeft, readRight, record -> {
                if (cancelled) {
                    throw new CancellationException("Diff cancelled");
                }
                summary.recordEmitted(record);
                stream.emit(record);
            });
            summary.exactDiff(result.getLeftRows(), result.getRightRows());
        }
    }
}
