package org.genemeta.datapipeline.statistics;

/**
 * Output of a random-effects pooling.
 *
 * @param thetaFixed    Fixed-effect (inverse-variance) estimate.
 * @param thetaRandom   DerSimonian–Laird random-effects estimate.
 * @param standardError Standard error of {@code thetaRandom}.
 * @param tau2          Between-study variance.
 * @param q             Cochran's Q.
 * @param i2            I² in percent; null for a single study.
 * @param z             Wald z of {@code thetaRandom}.
 * @param p             Two-sided p-value of {@code z}.
 * @param ciLower       Lower 95% confidence bound.
 * @param ciUpper       Upper 95% confidence bound.
 * @param studyCount    Number of pooled studies.
 */
public record PooledEstimate(double thetaFixed,
                             double thetaRandom,
                             double standardError,
                             double tau2,
                             double q,
                             Double i2,
                             double z,
                             double p,
                             double ciLower,
                             double ciUpper,
                             int studyCount) {
}
