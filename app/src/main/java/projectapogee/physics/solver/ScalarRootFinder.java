package projectapogee.physics.solver;

import java.util.function.DoubleUnaryOperator;

/**
 * Buscadores de raíces escalares con horquilla garantizada (bisección y Brent).
 * <p>
 * Ambos exigen {@code f(lo)} y {@code f(hi)} de signos opuestos, por lo que nunca divergen:
 * el peor caso está acotado por el número de iteraciones. Esta clase es thread safe.
 */
public final class ScalarRootFinder {

    private static final double MACHINE_EPSILON = Math.ulp(1.0);

    /**
     * Prohibido construir esta clase utilidad
     */
    private ScalarRootFinder() {
    }

    /**
     * Comprueba si {@code [lo, hi]} encierra un cambio de signo de {@code f}.
     */
    public static boolean isBracketed(double fLo, double fHi) {
        return (fLo <= 0 && fHi >= 0) || (fLo >= 0 && fHi <= 0);
    }

    /**
     * Bisección clásica.
     *
     * @param f          Función continua en {@code [lo, hi]}.
     * @param lo         Extremo inferior.
     * @param hi         Extremo superior.
     * @param xTolerance Anchura de horquilla a la que se da por convergido.
     * @param maxIterations Tope de iteraciones.
     * @return La raíz encontrada y su diagnóstico.
     * @throws IllegalArgumentException si la horquilla no encierra un cambio de signo.
     */
    public static RootResult bisect(DoubleUnaryOperator f, double lo, double hi, double xTolerance, int maxIterations) {
        double fLo = f.applyAsDouble(lo);
        double fHi = f.applyAsDouble(hi);
        if (!isBracketed(fLo, fHi)) {
            throw new IllegalArgumentException(String.format(
                    "La horquilla [%g, %g] no encierra una raíz (f=%g, %g)", lo, hi, fLo, fHi));
        }
        if (fLo == 0) return new RootResult(lo, 0.0, 0, true);
        if (fHi == 0) return new RootResult(hi, 0.0, 0, true);

        double mid = 0.5 * (lo + hi);
        double fMid = Double.NaN;
        for (int i = 1; i <= maxIterations; i++) {
            mid = 0.5 * (lo + hi);
            fMid = f.applyAsDouble(mid);
            if (fMid == 0 || 0.5 * (hi - lo) < xTolerance) {
                return new RootResult(mid, fMid, i, true);
            }
            if ((fMid < 0) == (fLo < 0)) {
                lo = mid;
                fLo = fMid;
            } else {
                hi = mid;
            }
        }
        return new RootResult(mid, fMid, maxIterations, false);
    }

    /**
     * Método de Brent: combina bisección, secante e interpolación cuadrática inversa.
     * Converge superlinealmente en funciones suaves conservando la garantía de la bisección.
     *
     * @param f          Función continua en {@code [lo, hi]}.
     * @param lo         Extremo inferior.
     * @param hi         Extremo superior.
     * @param xTolerance Tolerancia absoluta en x.
     * @param maxIterations Tope de iteraciones.
     * @return La raíz encontrada y su diagnóstico.
     * @throws IllegalArgumentException si la horquilla no encierra un cambio de signo.
     */
    public static RootResult brent(DoubleUnaryOperator f, double lo, double hi, double xTolerance, int maxIterations) {
        double a = lo;
        double b = hi;
        double fa = f.applyAsDouble(a);
        double fb = f.applyAsDouble(b);
        if (!isBracketed(fa, fb)) {
            throw new IllegalArgumentException(String.format(
                    "La horquilla [%g, %g] no encierra una raíz (f=%g, %g)", lo, hi, fa, fb));
        }
        if (fa == 0) return new RootResult(a, 0.0, 0, true);
        if (fb == 0) return new RootResult(b, 0.0, 0, true);

        double c = b;
        double fc = fb;
        double d = b - a;
        double e = d;

        for (int i = 1; i <= maxIterations; i++) {
            if ((fb > 0 && fc > 0) || (fb < 0 && fc < 0)) {
                // b y c en el mismo lado: recuperar la horquilla con a
                c = a;
                fc = fa;
                d = b - a;
                e = d;
            }
            if (Math.abs(fc) < Math.abs(fb)) {
                a = b;
                b = c;
                c = a;
                fa = fb;
                fb = fc;
                fc = fa;
            }
            double tol = 2.0 * MACHINE_EPSILON * Math.abs(b) + 0.5 * xTolerance;
            double xm = 0.5 * (c - b);
            if (Math.abs(xm) <= tol || fb == 0) {
                return new RootResult(b, fb, i, true);
            }
            if (Math.abs(e) >= tol && Math.abs(fa) > Math.abs(fb)) {
                double s = fb / fa;
                double p;
                double q;
                if (a == c) {
                    // Secante
                    p = 2.0 * xm * s;
                    q = 1.0 - s;
                } else {
                    // Interpolación cuadrática inversa
                    double qq = fa / fc;
                    double r = fb / fc;
                    p = s * (2.0 * xm * qq * (qq - r) - (b - a) * (r - 1.0));
                    q = (qq - 1.0) * (r - 1.0) * (s - 1.0);
                }
                if (p > 0) {
                    q = -q;
                }
                p = Math.abs(p);
                double min1 = 3.0 * xm * q - Math.abs(tol * q);
                double min2 = Math.abs(e * q);
                if (2.0 * p < Math.min(min1, min2)) {
                    e = d;
                    d = p / q;
                } else {
                    d = xm;
                    e = d;
                }
            } else {
                d = xm;
                e = d;
            }
            a = b;
            fa = fb;
            b += (Math.abs(d) > tol) ? d : Math.copySign(tol, xm);
            fb = f.applyAsDouble(b);
        }
        return new RootResult(b, fb, maxIterations, false);
    }
}
