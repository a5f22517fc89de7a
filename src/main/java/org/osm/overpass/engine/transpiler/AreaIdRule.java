package org.osm.overpass.engine.transpiler;

/**
 * How area ids relate to the ids of the ways and relations they are built from.
 * A way-derived area keeps the way id; a relation-derived area adds a fixed
 * offset to the relation id.
 *
 * @param relationOffset   Added to a relation id to get its area id
 * @param viewsExposeAreaIds True when the backend's area views already hold
 *                         derived area ids, false when they hold the native
 *                         way/relation id and kind
 */
public record AreaIdRule(long relationOffset, boolean viewsExposeAreaIds) {

    public static final long OSM_RELATION_OFFSET = 3_600_000_000L;

    public AreaIdRule {
        if (relationOffset <= 0) {
            throw new IllegalArgumentException("Relation offset must be positive: " + relationOffset);
        }
    }

    public long fromWay(long wayId) {
        return wayId;
    }

    public long fromRelation(long relationId) {
        return relationId + relationOffset;
    }

    public boolean isRelationArea(long areaId) {
        return areaId >= relationOffset;
    }

    /**
     * @return The id of the way or relation an area was derived from
     */
    public long sourceId(long areaId) {
        return isRelationArea(areaId) ? areaId - relationOffset : areaId;
    }
}
