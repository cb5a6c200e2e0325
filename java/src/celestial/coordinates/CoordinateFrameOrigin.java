package celestial.coordinates;

import java.io.Serializable;
import java.util.Objects;

/**
 * 坐标原点
 *
 * 地心、日心或站心（某一地理位置）。
 */
public final class CoordinateFrameOrigin implements Serializable {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        GEOCENTRIC,
        HELIOCENTRIC,
        TOPOCENTRIC
    }

    public static final CoordinateFrameOrigin GEOCENTRIC = new CoordinateFrameOrigin(Kind.GEOCENTRIC, null);
    public static final CoordinateFrameOrigin HELIOCENTRIC = new CoordinateFrameOrigin(Kind.HELIOCENTRIC, null);

    private final Kind kind;
    private final GeographicLocation location;

    private CoordinateFrameOrigin(Kind kind, GeographicLocation location) {
        this.kind = kind;
        this.location = location;
    }

    public static CoordinateFrameOrigin topocentric(GeographicLocation location) {
        return new CoordinateFrameOrigin(Kind.TOPOCENTRIC, Objects.requireNonNull(location, "location"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 站心原点的地理位置，其余原点为 null
     */
    public GeographicLocation getLocation() {
        return location;
    }

    public boolean isTopocentric() {
        return kind == Kind.TOPOCENTRIC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoordinateFrameOrigin)) {
            return false;
        }
        CoordinateFrameOrigin that = (CoordinateFrameOrigin) o;
        return kind == that.kind && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location);
    }

    @Override
    public String toString() {
        return kind == Kind.TOPOCENTRIC ? "topocentric " + location : kind.name().toLowerCase();
    }
}
