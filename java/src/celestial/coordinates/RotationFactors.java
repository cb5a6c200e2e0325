package celestial.coordinates;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * 某坐标系在某历元相对银道坐标系的三个旋转角（以余弦、正弦成对给出）
 *
 * 从银道坐标系到该坐标系依次绕 Z、Y、Z 轴旋转 a0、a1、a2。
 */
final class RotationFactors {

    private final double cos0;
    private final double sin0;
    private final double cos1;
    private final double sin1;
    private final double cos2;
    private final double sin2;

    RotationFactors(double[] values) {
        if (values.length < 6) {
            throw new IllegalArgumentException("Rotation table rows need 6 values, got " + values.length);
        }
        this.cos0 = values[0];
        this.sin0 = values[1];
        this.cos1 = values[2];
        this.sin1 = values[3];
        this.cos2 = values[4];
        this.sin2 = values[5];
    }

    Vector3D fromGalactic(Vector3D v) {
        Vector3D r = rotateZ(v, cos0, sin0, 1.0);
        r = rotateY(r, cos1, sin1, 1.0);
        return rotateZ(r, cos2, sin2, 1.0);
    }

    Vector3D toGalactic(Vector3D v) {
        Vector3D r = rotateZ(v, cos2, sin2, -1.0);
        r = rotateY(r, cos1, sin1, -1.0);
        return rotateZ(r, cos0, sin0, -1.0);
    }

    static Vector3D rotateZ(Vector3D v, double cos, double sin, double sign) {
        return new Vector3D(v.getX() * cos - v.getY() * sign * sin,
                            v.getX() * sign * sin + v.getY() * cos,
                            v.getZ());
    }

    static Vector3D rotateY(Vector3D v, double cos, double sin, double sign) {
        return new Vector3D(v.getX() * cos + v.getZ() * sign * sin,
                            v.getY(),
                            -v.getX() * sign * sin + v.getZ() * cos);
    }
}
