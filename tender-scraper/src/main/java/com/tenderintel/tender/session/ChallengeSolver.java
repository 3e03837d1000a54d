package com.tenderintel.tender.session;

/**
 * Turns a verification-code image into text. One call is one attempt;
 * the login flow decides how many attempts to make.
 */
public interface ChallengeSolver {

    /**
     * @return the solved text, never blank
     * @throws ChallengeSolvingException if this attempt failed
     */
    String solve(byte[] image);
}
