package io.xdiff.accessor.mongo;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.bson.Document;
import org.bson.UuidRepresentation;
import org.bson.conversions.Bson;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ReadConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;

import io.xdiff.accessor.Checksums;
import io.xdiff.accessor.KeyBounds;
import io.xdiff.accessor.RowCursor;
import io.xdiff.accessor.TableAccessException;
import io.xdiff.accessor.TableAccessor;
import io.xdiff.accessor.ValueNormalizer;
import io.xdiff.model.ColumnSpec;
import io.xdiff.model.KeyRange;
import io.xdiff.model.KeyType;
import io.xdiff.model.Row;
import io.xdiff.model.Segment;
import io.xdiff.model.TablePath;
import io.xdiff.model.TableRef;
import io.xdiff.partition.KeySpace;

/**
 * {@link TableAccessor} over a MongoDB collection. The table path is {@code database.collection}.
 * <p>
 * MongoDB has no server side MD5, so a segment streams the projected documents of its range and hashes
 * them client side, counting them in the same pass. Comparing a collection therefore reads every
 * projected document of each mismatching range once per bisection level: the whole collection for the
 * first comparison, then only the ranges that still differ. Bounds and plain counts run on the server.
 * <p>
 * The default {@code _id} key holds ObjectIds; use {@link KeyType#OBJECTID} for it.
 */
public class MongoTableAccessor implements TableAccessor {

    private static final Logger logger = LoggerFactory.getLogger(MongoTableAccessor.class);

    private static final int BATCH_SIZE = 10000;

    private final String name;
    private final MongoClient client;
    private final ValueNormalizer normalizer = new ValueNormalizer();

    public MongoTableAccessor(String name, String connectionString, int maxConnections) {
        this.name = name;
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(connectionString))
                .uuidRepresentation(UuidRepresentation.STANDARD)
                .applyToConnectionPoolSettings(builder -> builder.maxSize(maxConnections))
                .build();
        this.client = MongoClients.create(settings);
        logger.info("{}: connected to mongodb {}, maxPoolSize: {}", name,
                new ConnectionString(connectionString).getHosts(), maxConnections);
    }

    public MongoTableAccessor(String name, MongoClient client) {
        this.name = name;
        this.client = client;
    }

    @Override
    public Optional<KeyBounds> bounds(TableRef table) {
        KeySpace keySpace = KeySpace.forType(table.getKeyType());
        try {
            MongoCollection<Document> coll = collection(table);
            Bson projection = Projections.include(table.getKeyColumn());
            Document min = coll.find().projection(projection).sort(Sorts.ascending(table.getKeyColumn())).first();
            Document max = coll.find().projection(projection).sort(Sorts.descending(table.getKeyColumn())).first();
            if (min == null || max == null) {
                return Optional.empty();
            }
            Object rawMin = field(min, table.getKeyColumn());
            Object rawMax = field(max, table.getKeyColumn());
            checkKeyType(table, rawMin);
            checkKeyType(table, rawMax);
            return Optional.of(new KeyBounds(keySpace.coerce(toJava(rawMin)), keySpace.coerce(toJava(rawMax))));
        } catch (MongoException e) {
            throw wrap("bounds", table, null, e);
        }
    }

    @Override
    public long count(TableRef table, KeyRange range) {
        try {
            return collection(table).countDocuments(rangeFilter(table.getKeyColumn(), table.getKeyType(), range));
        } catch (MongoException e) {
            throw wrap("count", table, range, e);
        }
    }

    @Override
    public BigInteger checksum(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        return segment("checksum", table, range, columns).getChecksum();
    }

    /**
     * Count and checksum from a single pass over the range.
     */
    @Override
    public Segment segment(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        return segment("segment", table, range, columns);
    }

    private Segment segment(String operation, TableRef table, KeyRange range, List<ColumnSpec> columns) {
        try (MongoCursor<Document> cursor = find(table, range, columns)) {
            return hashDocuments(cursor, table, range, columns, normalizer);
        } catch (MongoException e) {
            throw wrap(operation, table, range, e);
        }
    }

    static Segment hashDocuments(Iterator<Document> documents, TableRef table, KeyRange range,
                                 List<ColumnSpec> columns, ValueNormalizer normalizer) {
        ColumnSpec keySpec = table.getKeySpec();
        long count = 0;
        BigInteger sum = BigInteger.ZERO;
        while (documents.hasNext()) {
            Document doc = documents.next();
            String key = normalizer.normalize(toJava(field(doc, table.getKeyColumn())), keySpec);
            List<String> values = values(doc, columns, normalizer);
            sum = sum.add(BigInteger.valueOf(Checksums.md5AsLong(Checksums.rowText(key, values))));
            count++;
        }
        return new Segment(table.getSide(), range, count, sum);
    }

    @Override
    public RowCursor rows(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        KeySpace keySpace = KeySpace.forType(table.getKeyType());
        MongoCursor<Document> cursor;
        try {
            cursor = find(table, range, columns);
        } catch (MongoException e) {
            throw wrap("rows", table, range, e);
        }
        return new RowCursor() {
            @Override
            public boolean hasNext() {
                try {
                    return cursor.hasNext();
                } catch (MongoException e) {
                    throw wrap("rows", table, range, e);
                }
            }

            @Override
            public Row next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Document doc = cursor.next();
                Object key = keySpace.coerce(toJava(field(doc, table.getKeyColumn())));
                return new Row(key, values(doc, columns, normalizer));
            }

            @Override
            public void close() {
                cursor.close();
            }
        };
    }

    @Override
    public void close() {
        logger.debug("{}: closing client", name);
        client.close();
    }

    /**
     * Range query on the key field, the same shape as a partition query: {@code $gte} the start and,
     * for bounded ranges, {@code $lt} the end.
     */
    public static Bson rangeFilter(String keyField, KeyType keyType, KeyRange range) {
        Bson lower = Filters.gte(keyField, toBson(range.getStart(), keyType));
        if (range.isUnboundedEnd()) {
            return lower;
        }
        return Filters.and(lower, Filters.lt(keyField, toBson(range.getEnd(), keyType)));
    }

    static Object toBson(Object key, KeyType keyType) {
        switch (keyType) {
            case DECIMAL:
                return new Decimal128((BigDecimal) key);
            case TIMESTAMP:
                return Date.from(((LocalDateTime) key).toInstant(ZoneOffset.UTC));
            case OBJECTID:
                return new ObjectId((String) key);
            default:
                return key;
        }
    }

    static Object toJava(Object bson) {
        if (bson instanceof Decimal128) {
            return ((Decimal128) bson).bigDecimalValue();
        }
        if (bson instanceof ObjectId) {
            return ((ObjectId) bson).toHexString();
        }
        if (bson instanceof Binary) {
            return ((Binary) bson).getData();
        }
        if (bson instanceof Document) {
            return ((Document) bson).toJson();
        }
        return bson;
    }

    private MongoCursor<Document> find(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        List<String> fields = new ArrayList<>();
        fields.add(table.getKeyColumn());
        columns.forEach(c -> fields.add(c.getName()));
        return collection(table)
                .find(rangeFilter(table.getKeyColumn(), table.getKeyType(), range))
                .projection(Projections.include(fields))
                .sort(Sorts.ascending(table.getKeyColumn()))
                .batchSize(BATCH_SIZE)
                .iterator();
    }

    // range operators only match values of the operand's BSON type
    private void checkKeyType(TableRef table, Object rawKey) {
        if (rawKey instanceof ObjectId && table.getKeyType() != KeyType.OBJECTID) {
            throw new TableAccessException(name + ": key " + table.getKeyColumn() + " of " + table.getPath()
                    + " holds ObjectIds, compare it with key type objectid instead of " + table.getKeyType(), false);
        }
    }

    private static List<String> values(Document doc, List<ColumnSpec> columns, ValueNormalizer normalizer) {
        List<String> values = new ArrayList<>(columns.size());
        for (ColumnSpec c : columns) {
            values.add(normalizer.normalize(toJava(field(doc, c.getName())), c));
        }
        return values;
    }

    private static Object field(Document doc, String path) {
        if (path.indexOf('.') < 0) {
            return doc.get(path);
        }
        return doc.getEmbedded(Arrays.asList(path.split("\\.")), Object.class);
    }

    private MongoCollection<Document> collection(TableRef table) {
        TablePath path = table.getPath();
        if (!path.hasSchema()) {
            throw new IllegalArgumentException("MongoDB table must be given as database.collection: " + path);
        }
        return client.getDatabase(path.getSchemaName()).getCollection(path.getTableName())
                .withReadConcern(ReadConcern.MAJORITY);
    }

    private TableAccessException wrap(String operation, TableRef table, KeyRange range, MongoException e) {
        String where = range == null ? "" : " range " + range;
        boolean transientFailure = e instanceof MongoSocketException || e instanceof MongoTimeoutException
                || e instanceof MongoExecutionTimeoutException || e.hasErrorLabel("TransientTransactionError");
        return new TableAccessException(name + ": " + operation + " on " + table.getPath() + where + " failed: "
                + e.getMessage(), e, transientFailure);
    }
}
