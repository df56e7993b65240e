package org.example.shaker;

import org.apache.maven.plugins.annotations.Mojo;
import org.example.shaker.exception.ShakerException;

/**
 * Refreshes the formula workspace from formula-requirements.txt, or from
 * metadata.yml when no requirements have been pinned yet.
 *
 * Usage: mvn shaker:shake
 */
@Mojo(name = "shake", requiresProject = false, threadSafe = true)
public class ShakeMojo extends AbstractShakerMojo {

    @Override
    protected ShakeResult run(SaltShaker shaker) throws ShakerException {
        return shaker.shake();
    }

    @Override
    protected String getGoalDescription() {
        return "Refreshing Formulas";
    }
}
