package io.github.yok.blogvault.core;

/**
 * Phases of a restore run. Phases advance strictly in declaration order; {@link #ROLLED_BACK} is
 * reachable from any phase before {@link #COMMITTED}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RestoreState {
    SCANNING, IMPORTING, LEGACY_CONFIG_MIGRATION, LEGACY_ASSET_IMPORT, COMMITTED, ROLLED_BACK
}
