package nasa.nccs.regrid.engine;

/**
 * The external numerical engine that derives regrid weights. Engines initialise themselves on first
 * use; each operator build opens its own session and destroys it before returning.
 */
public interface WeightEngine {

    EngineSession open() throws WeightEngineException;
}
