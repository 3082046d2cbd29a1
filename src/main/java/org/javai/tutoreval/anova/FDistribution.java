package org.javai.tutoreval.anova;

/**
 * Upper-tail probabilities of the F distribution through the regularized incomplete beta function.
 * Log-gamma uses the Lanczos approximation (g = 7, nine coefficients); the incomplete beta is evaluated
 * as a continued fraction with the modified Lentz method.
 */
public final class FDistribution {

	private static final double[] LANCZOS = {
			0.99999999999980993,
			676.5203681218851,
			-1259.1392167224028,
			771.32342877765313,
			-176.61502916214059,
			12.507343278686905,
			-0.13857109526572012,
			9.9843695780195716e-6,
			1.5056327351493116e-7
	};
	private static final int LANCZOS_G = 7;

	private static final int MAX_ITERATIONS = 200;
	private static final double EPSILON = 3e-14;
	private static final double FP_MIN = 1e-30;

	private FDistribution() {
	}

	/**
	 * {@code P(F > f)} for {@code d1} and {@code d2} degrees of freedom. Non-positive {@code f} gives 1,
	 * infinite {@code f} gives 0.
	 */
	public static double upperTail(double f, double d1, double d2) {
		if (Double.isNaN(f) || f <= 0 || d1 <= 0 || d2 <= 0) {
			return 1.0;
		}
		if (Double.isInfinite(f)) {
			return 0.0;
		}
		double x = d1 * f / (d1 * f + d2);
		double p = 1.0 - regularizedBeta(x, d1 / 2, d2 / 2);
		return Math.min(1.0, Math.max(0.0, p));
	}

	static double lnGamma(double z) {
		if (z <= 0) {
			return Double.POSITIVE_INFINITY;
		}
		if (z < 0.5) {
			// reflection: Gamma(z) Gamma(1 - z) = pi / sin(pi z)
			return Math.log(Math.PI / Math.sin(Math.PI * z)) - lnGamma(1 - z);
		}
		double zm1 = z - 1;
		double x = LANCZOS[0];
		for (int i = 1; i < LANCZOS_G + 2; i++) {
			x += LANCZOS[i] / (zm1 + i);
		}
		double t = zm1 + LANCZOS_G + 0.5;
		return 0.5 * Math.log(2 * Math.PI) + (zm1 + 0.5) * Math.log(t) - t + Math.log(x);
	}

	static double regularizedBeta(double x, double a, double b) {
		if (x <= 0) {
			return 0.0;
		}
		if (x >= 1) {
			return 1.0;
		}
		if (x > (a + 1) / (a + b + 2)) {
			return 1.0 - regularizedBeta(1 - x, b, a);
		}
		double lnPrefactor = a * Math.log(x) + b * Math.log(1 - x) - Math.log(a)
				- lnGamma(a) - lnGamma(b) + lnGamma(a + b);
		return Math.exp(lnPrefactor) * continuedFraction(x, a, b);
	}

	private static double continuedFraction(double x, double a, double b) {
		double qab = a + b;
		double qap = a + 1;
		double qam = a - 1;
		double c = 1;
		double d = nonZero(1 - qab * x / qap);
		d = 1 / d;
		double h = d;
		for (int m = 1; m <= MAX_ITERATIONS; m++) {
			double aa = m * (b - m) * x / ((qam + 2 * m) * (a + 2 * m));
			d = 1 / nonZero(1 + aa * d);
			c = nonZero(1 + aa / c);
			h *= d * c;

			aa = -(a + m) * (qab + m) * x / ((a + 2 * m) * (qap + 2 * m));
			d = 1 / nonZero(1 + aa * d);
			c = nonZero(1 + aa / c);
			double delta = d * c;
			h *= delta;
			if (Math.abs(delta - 1) < EPSILON) {
				break;
			}
		}
		return h;
	}

	private static double nonZero(double value) {
		return Math.abs(value) < FP_MIN ? FP_MIN : value;
	}
}
