package org.cascadeslot.service.rtp;

/**
 * Pilotage du taux de redistribution. Deux implémentations : {@link DynamicRtpController}
 * (fenêtres glissantes, oriente les tirages) et {@link FixedOddsRtpController} (cotes fixes).
 */
public interface RtpController {

    void recordOutcome(long bet, long win);

    /** RTP réalisé pondéré ; vaut la cible tant qu'aucun échantillon n'est enregistré. */
    double realizedRtp();

    /** Décision aléatoire : vrai pour orienter le prochain tirage vers un gain. */
    boolean shouldBias(long bet);

    /** Facteur dans [0.5, 2.0] selon l'écart relatif entre RTP courant et cible. */
    double compensationMultiplier(double currentRtp, double targetRtp);

    double volatilityAdjustment();

    /** Facteur appliqué par le moteur à un gain brut non nul, dans [0.125, 8]. */
    double payoutFactor();

    double getTargetRtp();

    void setTargetRtp(double targetRtp);

    /** Faux si le contrôleur ne fait qu'observer. */
    boolean isSteering();

    RtpStatistics statistics();

    void reset();
}
