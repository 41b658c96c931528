package asl.spr;

import asl.spr.experiment.Experiment;
import asl.spr.experiment.FresnelModelExperiment;
import asl.spr.experiment.ReflectanceFitExperiment;
import asl.spr.experiment.SensorgramExperiment;

/**
 * Enumerated type defining each kind of analysis, done so a front end has a list of all
 * experiments available and for creating the associated Experiment class.
 *
 * If adding a new analysis, make sure to also create a new extension for Experiment.
 *
 * @author akearns - KBRWyle
 */
public enum ExperimentFactory {

  SENSORGRAM("Sensorgram") {
    @Override
    public Experiment createExperiment() {
      return new SensorgramExperiment();
    }
  },
  FRESNEL_MODEL("Fresnel model") {
    @Override
    public Experiment createExperiment() {
      return new FresnelModelExperiment();
    }
  },
  REFLECTANCE_FIT("Reflectance fit") {
    @Override
    public Experiment createExperiment() {
      return new ReflectanceFitExperiment();
    }
  };

  private final String name;

  ExperimentFactory(String name) {
    this.name = name;
  }

  /**
   * Creates the associated Experiment for the enum
   *
   * @return new Experiment
   */
  public abstract Experiment createExperiment();

  /**
   * Get the full name of this experiment (used for plot and report names)
   *
   * @return Name of experiment, as String
   */
  public String getName() {
    return name;
  }
}
