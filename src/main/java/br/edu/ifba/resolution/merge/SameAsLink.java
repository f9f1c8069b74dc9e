package br.edu.ifba.resolution.merge;

/**
 * Symmetric same-as relation between two records of one cluster, stored with
 * the smaller id first.
 */
public record SameAsLink(String recordId1, String recordId2, int clusterId) {
    
    public SameAsLink {
        if (recordId1 == null || recordId2 == null) {
            throw new IllegalArgumentException("record ids cannot be null");
        }
        if (recordId1.equals(recordId2)) {
            throw new IllegalArgumentException("A record cannot link to itself: " + recordId1);
        }
        if (recordId1.compareTo(recordId2) > 0) {
            String swap = recordId1;
            recordId1 = recordId2;
            recordId2 = swap;
        }
    }
}
