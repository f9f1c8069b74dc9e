package br.edu.ifba.resolution.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of records judged to be the same entity.
 *
 * @param id cluster id, assigned in order of smallest member id starting at 1
 * @param memberIds member record ids in ascending order
 */
public record Cluster(int id, List<String> memberIds) {
    
    public Cluster {
        if (memberIds == null || memberIds.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
        List<String> sorted = new ArrayList<>(memberIds);
        Collections.sort(sorted);
        memberIds = List.copyOf(sorted);
    }
    
    public int size() {
        return memberIds.size();
    }
    
    public String smallestMemberId() {
        return memberIds.get(0);
    }
}
