package celestial.coordinates;

/**
 * 坐标系类型
 *
 * 除银道坐标系外，每种类型都对应一张旋转角度表（以银道坐标系为枢纽）。
 * 地平坐标系借用 FK5 历元当日的表，再做本地旋转。
 */
public enum CoordinateFrameType {

    /** 国际天球参考系，由河外射电源定义，无历元 */
    ICRF("icrs", false, "α", "δ"),
    FK4("fk4", true, "α", "δ"),
    FK5("fk5", true, "α", "δ"),
    /** 平黄道坐标系（只考虑岁差） */
    MEAN_ECLIPTIC("meanecliptic", true, "λ", "β"),
    /** 真黄道坐标系（考虑章动） */
    TRUE_ECLIPTIC("trueecliptic", true, "λ", "β"),
    GALACTIC(null, false, "l", "b"),
    /** 地平坐标系：经度为方位角（北起向东），纬度为高度角 */
    HORIZONTAL("fk5", true, "A", "h");

    private final String tableName;
    private final boolean equinoxRequired;
    private final String longitudeSymbol;
    private final String latitudeSymbol;

    CoordinateFrameType(String tableName, boolean equinoxRequired,
                        String longitudeSymbol, String latitudeSymbol) {
        this.tableName = tableName;
        this.equinoxRequired = equinoxRequired;
        this.longitudeSymbol = longitudeSymbol;
        this.latitudeSymbol = latitudeSymbol;
    }

    /**
     * 旋转角度表名称，银道坐标系为 null
     */
    public String getTableName() {
        return tableName;
    }

    public boolean isEquinoxRequired() {
        return equinoxRequired;
    }

    public boolean isEquatorial() {
        return this == ICRF || this == FK4 || this == FK5;
    }

    public String getLongitudeSymbol() {
        return longitudeSymbol;
    }

    public String getLatitudeSymbol() {
        return latitudeSymbol;
    }
}
