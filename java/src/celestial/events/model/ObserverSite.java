package celestial.events.model;

import celestial.coordinates.GeographicLocation;

import java.util.Objects;

/**
 * 观测站点
 *
 * 带标识的地理位置，批量计算中用作结果的键。
 */
public class ObserverSite {
    private final String id;
    private final String name;
    private final GeographicLocation location;

    /**
     * 创建观测站点
     *
     * @param id 站点ID
     * @param name 名称
     * @param location 地理位置
     */
    public ObserverSite(String id, String name, GeographicLocation location) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.location = Objects.requireNonNull(location, "location");
    }

    /**
     * 由角度创建（名称与ID相同）
     */
    public static ObserverSite ofDegrees(String id, double latitude, double longitude) {
        return new ObserverSite(id, id, GeographicLocation.ofDegrees(latitude, longitude));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public GeographicLocation getLocation() { return location; }

    @Override
    public String toString() {
        return "ObserverSite{id='" + id + "', name='" + name + "', " + location + '}';
    }
}
