/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

/**
 * One row of the {@code OI_TARGET} table. Angles are in degrees, velocities in m/s,
 * proper motions in deg/yr and parallaxes in degrees, following the OIFITS conventions.
 * <p>
 * Use {@link #builder()} to start from the documented defaults: target id 0, name
 * {@code "MyTarget"}, all numeric fields 0 and all other text fields empty.
 * </p>
 */
public record Target(
        int targetId,
        String target,
        double raep0,
        double decep0,
        double equinox,
        double raErr,
        double decErr,
        double sysvel,
        String veltyp,
        String veldef,
        double pmra,
        double pmdec,
        double pmraErr,
        double pmdecErr,
        double parallax,
        double paraErr,
        String spectyp,
        String category) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private int targetId = 0;
        private String target = "MyTarget";
        private double raep0;
        private double decep0;
        private double equinox;
        private double raErr;
        private double decErr;
        private double sysvel;
        private String veltyp = "";
        private String veldef = "";
        private double pmra;
        private double pmdec;
        private double pmraErr;
        private double pmdecErr;
        private double parallax;
        private double paraErr;
        private String spectyp = "";
        private String category = "";

        private Builder() {
        }

        public Builder targetId(int targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder coordinates(double raep0, double decep0, double equinox) {
            this.raep0 = raep0;
            this.decep0 = decep0;
            this.equinox = equinox;
            return this;
        }

        public Builder coordinateErrors(double raErr, double decErr) {
            this.raErr = raErr;
            this.decErr = decErr;
            return this;
        }

        public Builder systemicVelocity(double sysvel, String veltyp, String veldef) {
            this.sysvel = sysvel;
            this.veltyp = veltyp;
            this.veldef = veldef;
            return this;
        }

        public Builder properMotion(double pmra, double pmdec) {
            this.pmra = pmra;
            this.pmdec = pmdec;
            return this;
        }

        public Builder properMotionErrors(double pmraErr, double pmdecErr) {
            this.pmraErr = pmraErr;
            this.pmdecErr = pmdecErr;
            return this;
        }

        public Builder parallax(double parallax, double paraErr) {
            this.parallax = parallax;
            this.paraErr = paraErr;
            return this;
        }

        public Builder spectralType(String spectyp) {
            this.spectyp = spectyp;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Target build() {
            return new Target(targetId, target, raep0, decep0, equinox, raErr, decErr, sysvel, veltyp, veldef,
                    pmra, pmdec, pmraErr, pmdecErr, parallax, paraErr, spectyp, category);
        }
    }
}
