package celestial.bodies;

import celestial.coordinates.CoordinateFrame;
import celestial.coordinates.CoordinateFrameOrigin;
import celestial.coordinates.FrameTransformer;
import celestial.coordinates.OriginTranslator;
import celestial.coordinates.RectangularCoordinates;
import celestial.coordinates.SphericalCoordinates;
import celestial.ephemeris.EphemerisRangeException;
import celestial.ephemeris.EphemerisSeries;
import celestial.time.JulianDate;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * 由星历表给出位置的天体
 *
 * 位置表为 ICRS 地心直角坐标（米）。任意坐标系下的位置先在 ICRS 中平移到目标原点，
 * 再旋转到目标坐标系。地球本身用一个极小的非零矢量作为地心占位，避免退化的三角运算。
 */
public class EphemerisBody {

    /** 地心占位矢量，模长远小于距离判定阈值 */
    static final Vector3D EARTH_PROXY = new Vector3D(0.0, 0.0, 1.0e-11);

    private final BodyDescriptor descriptor;
    private final EphemerisSeries series;
    private final FrameTransformer transformer;
    private final OriginTranslator translator;

    /**
     * 创建天体，位置表从变换器的星历上下文中按名称查找（地球不需要位置表）
     */
    public EphemerisBody(BodyDescriptor descriptor, FrameTransformer transformer) {
        this(descriptor,
             descriptor.isEarth() ? null : transformer.getContext().getBodyTable(descriptor.getTableName()),
             transformer);
    }

    public EphemerisBody(BodyDescriptor descriptor, EphemerisSeries series, FrameTransformer transformer) {
        if (series == null && !descriptor.isEarth()) {
            throw new IllegalArgumentException("No ephemeris series for " + descriptor);
        }
        this.descriptor = descriptor;
        this.series = series;
        this.transformer = transformer;
        this.translator = new OriginTranslator(transformer);
    }

    public BodyDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.getName();
    }

    public BodyKind getKind() {
        return descriptor.getKind();
    }

    /**
     * 位置表，地球为 null
     */
    public EphemerisSeries getSeries() {
        return series;
    }

    /**
     * 某时刻在指定坐标系中的直角坐标
     *
     * @throws EphemerisRangeException 时刻超出位置表或旋转表范围
     */
    public RectangularCoordinates rectangularCoordinates(JulianDate epoch, CoordinateFrame frame) {
        Vector3D geocentric = descriptor.isEarth() ? EARTH_PROXY : interpolatedPosition(epoch);
        CoordinateFrameOrigin origin = frame.getOrigin();
        Vector3D position = origin.equals(CoordinateFrameOrigin.GEOCENTRIC)
                ? geocentric
                : geocentric.subtract(translator.geocentricPosition(origin, epoch));
        RectangularCoordinates icrs = new RectangularCoordinates(position, CoordinateFrame.ICRS.withOrigin(origin));
        return transformer.transform(icrs, frame);
    }

    public SphericalCoordinates sphericalCoordinates(JulianDate epoch, CoordinateFrame frame) {
        return rectangularCoordinates(epoch, frame).toSpherical();
    }

    private Vector3D interpolatedPosition(JulianDate epoch) {
        double[] values = series.interpolate(epoch);
        return new Vector3D(values[0], values[1], values[2]);
    }

    @Override
    public String toString() {
        return "EphemerisBody{" + descriptor.getName() + ", " + descriptor.getKind() + '}';
    }
}
