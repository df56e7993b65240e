package org.example.shaker;

import org.apache.maven.plugins.annotations.Mojo;
import org.example.shaker.exception.ShakerException;

/**
 * Recalculates all formula dependencies from metadata.yml, ignoring pinned
 * requirements, and rewrites formula-requirements.txt.
 *
 * Usage: mvn shaker:update
 */
@Mojo(name = "update", requiresProject = false, threadSafe = true)
public class UpdateMojo extends AbstractShakerMojo {

    @Override
    protected ShakeResult run(SaltShaker shaker) throws ShakerException {
        return shaker.update();
    }

    @Override
    protected String getGoalDescription() {
        return "Updating Formulas";
    }
}
