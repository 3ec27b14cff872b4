package org.genemeta.datapipeline.services.ranking;

/**
 * Thrown when a ranking query names a disease label that is not in the disease reference set.
 */
public class DiseaseNotFoundException extends Exception {

    public DiseaseNotFoundException(String label) {
        super("Unknown disease '" + label + "'");
    }
}
