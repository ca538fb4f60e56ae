package projectapogee.domain.motor;

import lombok.Builder;
import lombok.With;
import projectapogee.domain.exception.InvalidGeometryException;

/**
 * Geometría inicial de un grano BATES: {@code segmentCount} cilindros huecos idénticos que
 * queman radialmente hacia fuera por el núcleo y axialmente por sus caras extremas libres.
 * <p>
 * Todas las consultas dependientes del tiempo se expresan en función de la regresión de web
 * {@code x} [m] (espesor quemado desde el encendido), de modo que el objeto es inmutable:
 * <ul>
 *     <li>Diámetro de núcleo: {@code d(x) = d0 + 2x}</li>
 *     <li>Longitud de segmento: {@code L(x) = L0 - e·x}, con {@code e} caras expuestas.</li>
 * </ul>
 *
 * @param coreDiameter    Diámetro inicial del núcleo d0 [m].
 * @param outerDiameter   Diámetro exterior D [m].
 * @param segmentLength   Longitud inicial de cada segmento L0 [m].
 * @param segmentCount    Número de segmentos N.
 * @param exposedEndFaces Caras extremas que queman por segmento (0, 1 o 2).
 */
@Builder
@With
public record GrainGeometry(
        double coreDiameter,
        double outerDiameter,
        double segmentLength,
        int segmentCount,
        int exposedEndFaces
) {

    public double coreDiameterAt(double regression) {
        return coreDiameter + 2.0 * regression;
    }

    public double segmentLengthAt(double regression) {
        return segmentLength - exposedEndFaces * regression;
    }

    /**
     * Web inicial: el menor de los espesores radial y axial.
     * La combustión termina cuando la regresión alcanza este valor.
     */
    public double webThickness() {
        double radialWeb = (outerDiameter - coreDiameter) / 2.0;
        if (exposedEndFaces == 0) {
            return radialWeb;
        }
        return Math.min(radialWeb, segmentLength / exposedEndFaces);
    }

    public double remainingWebAt(double regression) {
        return Math.max(0.0, webThickness() - regression);
    }

    /**
     * Área de combustión total del grano tras una regresión {@code x} [m²].
     * Núcleo: {@code π·d·L}; caras: {@code e·π/4·(D² - d²)}, multiplicado por el número de segmentos.
     */
    public double burningAreaAt(double regression) {
        if (remainingWebAt(regression) <= 0) {
            return 0.0;
        }
        double d = coreDiameterAt(regression);
        double l = segmentLengthAt(regression);
        double coreArea = Math.PI * d * l;
        double faceArea = exposedEndFaces * Math.PI / 4.0 * (outerDiameter * outerDiameter - d * d);
        return segmentCount * (coreArea + faceArea);
    }

    public double portArea() {
        return Math.PI / 4.0 * coreDiameter * coreDiameter;
    }

    /**
     * Relación área de puerto / área de garganta. Por debajo de ~2 el flujo por el núcleo
     * se acerca a condiciones sónicas y aparece combustión erosiva.
     */
    public double portToThroatRatio(double throatArea) {
        return portArea() / throatArea;
    }

    public double totalLength() {
        return segmentCount * segmentLength;
    }

    public double lengthToDiameter() {
        return totalLength() / outerDiameter;
    }

    public double propellantVolume() {
        return segmentCount * Math.PI / 4.0 * (outerDiameter * outerDiameter - coreDiameter * coreDiameter) * segmentLength;
    }

    public double propellantMass(double propellantDensity) {
        return propellantVolume() * propellantDensity;
    }

    /**
     * Volumen del cilindro envolvente del grano (sin descontar el núcleo) [m³].
     */
    public double envelopeVolume() {
        return Math.PI / 4.0 * outerDiameter * outerDiameter * totalLength();
    }

    /**
     * Comprueba que la geometría es un grano BATES físicamente posible.
     *
     * @throws InvalidGeometryException si algún valor no es físico.
     */
    public void validate() {
        if (!(coreDiameter > 0) || !Double.isFinite(coreDiameter)) {
            throw new InvalidGeometryException("El diámetro de núcleo debe ser positivo: " + coreDiameter);
        }
        if (!(outerDiameter > coreDiameter) || !Double.isFinite(outerDiameter)) {
            throw new InvalidGeometryException(String.format(
                    "El diámetro de núcleo (%.5f m) debe ser menor que el exterior (%.5f m)", coreDiameter, outerDiameter));
        }
        if (!(segmentLength > 0) || !Double.isFinite(segmentLength)) {
            throw new InvalidGeometryException("La longitud de segmento debe ser positiva: " + segmentLength);
        }
        if (segmentCount < 1) {
            throw new InvalidGeometryException("Se necesita al menos un segmento: " + segmentCount);
        }
        if (exposedEndFaces < 0 || exposedEndFaces > 2) {
            throw new InvalidGeometryException("Las caras extremas expuestas deben ser 0, 1 o 2: " + exposedEndFaces);
        }
    }
}
