package com.tony.franchiseSimulator.service;

/**
 * Source de tirages uniformes. Toute opération aléatoire du moteur passe par elle,
 * ce qui permet aux tests de fournir une séquence déterministe.
 */
@FunctionalInterface
public interface RandomSource {

    /** @return un réel uniforme dans [0, 1) */
    double next();
}
