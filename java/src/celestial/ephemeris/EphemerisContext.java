package celestial.ephemeris;

import org.orekit.errors.OrekitException;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 星历上下文
 *
 * 持有坐标系旋转表（按表名）和天体位置表（按天体名）。通过 {@link Builder} 一次性构建，
 * 之后只读，可在线程间共享。所有插值、坐标变换和事件计算都显式接收该上下文。
 */
public final class EphemerisContext {

    private static final Logger logger = Logger.getLogger(EphemerisContext.class.getName());

    /** 随库发布的坐标系旋转表 */
    private static final String[] DEFAULT_FRAME_TABLES = {"icrs", "fk5", "fk4", "meanecliptic", "trueecliptic"};

    private static final String RESOURCE_DIRECTORY = "/ephemerides/";
    private static final String RESOURCE_SUFFIX = ".ephem";

    private final Map<String, EphemerisSeries> frameTables;
    private final Map<String, EphemerisSeries> bodyTables;

    private EphemerisContext(Builder builder) {
        this.frameTables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.frameTables));
        this.bodyTables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.bodyTables));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 只包含默认坐标系旋转表的上下文
     */
    public static EphemerisContext loadDefault() {
        return builder().withDefaultFrameTables().build();
    }

    /**
     * 获取坐标系旋转表
     *
     * @throws OrekitException 未注册该表
     */
    public EphemerisSeries getFrameTable(String tableName) {
        EphemerisSeries series = frameTables.get(tableName);
        if (series == null) {
            throw new OrekitException(CelestialMessages.MISSING_EPHEMERIS, "frame table " + tableName);
        }
        return series;
    }

    /**
     * 获取天体位置表
     *
     * @throws OrekitException 未注册该天体
     */
    public EphemerisSeries getBodyTable(String bodyName) {
        EphemerisSeries series = bodyTables.get(normalizeKey(bodyName));
        if (series == null) {
            throw new OrekitException(CelestialMessages.MISSING_EPHEMERIS, "body " + bodyName);
        }
        return series;
    }

    public boolean hasBodyTable(String bodyName) {
        return bodyTables.containsKey(normalizeKey(bodyName));
    }

    public Set<String> getFrameTableNames() {
        return frameTables.keySet();
    }

    public Set<String> getBodyNames() {
        return bodyTables.keySet();
    }

    private static String normalizeKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "EphemerisContext{frameTables=" + frameTables.keySet() + ", bodyTables=" + bodyTables.keySet() + '}';
    }

    /**
     * 上下文构建器，非线程安全
     */
    public static final class Builder {

        private final Map<String, EphemerisSeries> frameTables = new LinkedHashMap<>();
        private final Map<String, EphemerisSeries> bodyTables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder withDefaultFrameTables() {
            for (String table : DEFAULT_FRAME_TABLES) {
                frameTables.put(table, EphemerisSeriesReader.readResource(table, resourceName(table)));
            }
            return this;
        }

        public Builder addFrameTable(String tableName, EphemerisSeries series) {
            frameTables.put(tableName, series);
            return this;
        }

        public Builder addBodyTable(String bodyName, EphemerisSeries series) {
            bodyTables.put(normalizeKey(bodyName), series);
            return this;
        }

        /**
         * 从类路径 /ephemerides/{name}.ephem 读取天体位置表
         */
        public Builder addBodyResource(String bodyName) {
            String key = normalizeKey(bodyName);
            return addBodyTable(key, EphemerisSeriesReader.readResource(key, resourceName(key)));
        }

        public Builder addBodyFile(String bodyName, Path path) {
            String key = normalizeKey(bodyName);
            return addBodyTable(key, EphemerisSeriesReader.readFile(key, path));
        }

        public EphemerisContext build() {
            EphemerisContext context = new EphemerisContext(this);
            logger.fine(() -> "Built " + context);
            return context;
        }

        private static String resourceName(String table) {
            return RESOURCE_DIRECTORY + table + RESOURCE_SUFFIX;
        }
    }
}
