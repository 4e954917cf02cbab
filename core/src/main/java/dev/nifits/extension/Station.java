/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * A single telescope station, i.e. one row of the {@code OI_ARRAY} table.
 * <p>
 * The field-of-view fields exist from revision 2 of the table on; for older revisions
 * they are always unset, whatever the constructor was given.
 * </p>
 */
public final class Station {

    private static final System.Logger LOG = System.getLogger(Station.class.getName());

    public static final int LATEST_REVISION = 2;

    private final int revision;
    private final String telescopeName;
    private final String stationName;
    private final double diameter;
    private final double[] position;
    private final Double fov;
    private final String fovType;

    /**
     * @param diameter aperture diameter in meters
     * @param position station coordinates (x, y, z) in meters
     * @param fov field-of-view radius in arcseconds, or {@code null}
     * @param fovType how {@code fov} is defined ({@code FWHM} or {@code RADIUS}), or {@code null}
     */
    public Station(String telescopeName, String stationName, double diameter, double[] position,
                   Double fov, String fovType, int revision) {
        if (position.length != 3) {
            throw new IllegalArgumentException("Station position must have 3 coordinates, got " + position.length);
        }
        if (revision > LATEST_REVISION) {
            LOG.log(System.Logger.Level.WARNING, "OI_ARRAY revision {0} not implemented yet", revision);
        }
        this.revision = revision;
        this.telescopeName = telescopeName;
        this.stationName = stationName;
        this.diameter = diameter;
        this.position = position.clone();
        if (revision >= 2) {
            this.fov = fov;
            this.fovType = fovType;
        }
        else {
            this.fov = null;
            this.fovType = null;
        }
    }

    public Station(String telescopeName, String stationName, double diameter, double[] position) {
        this(telescopeName, stationName, diameter, position, null, null, 1);
    }

    public int getRevision() {
        return revision;
    }

    public String getTelescopeName() {
        return telescopeName;
    }

    public String getStationName() {
        return stationName;
    }

    public double getDiameter() {
        return diameter;
    }

    public double[] getPosition() {
        return position.clone();
    }

    /**
     * @return the field-of-view radius, or {@code null} if unset
     */
    public Double getFov() {
        return fov;
    }

    public String getFovType() {
        return fovType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Station other)) {
            return false;
        }
        return revision == other.revision
                && Objects.equals(telescopeName, other.telescopeName)
                && Objects.equals(stationName, other.stationName)
                && Double.compare(diameter, other.diameter) == 0
                && Arrays.equals(position, other.position)
                && Objects.equals(fov, other.fov)
                && Objects.equals(fovType, other.fovType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(revision, telescopeName, stationName, diameter, Arrays.hashCode(position), fov, fovType);
    }

    @Override
    public String toString() {
        if (revision >= 2 && fov != null) {
            return String.format(Locale.ROOT, "%s/%s (%g m, fov %g arcsec (%s))", stationName, telescopeName, diameter, fov, fovType);
        }
        return String.format(Locale.ROOT, "%s/%s (%g m)", stationName, telescopeName, diameter);
    }
}
