package org.javai.experiment.lifecycle;

import org.javai.experiment.model.Experiment;

/**
 * An experiment before and after a committed compare-and-set.
 */
public record VersionedChange(Experiment previous, Experiment current) {
}
