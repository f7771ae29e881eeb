package com.platform.provisioner.lifecycle;

import com.platform.provisioner.identifier.ResourceIdentifierCodec;
import com.platform.provisioner.lookup.AbsenceRules;
import com.platform.provisioner.lookup.ResourceFinder;
import com.platform.provisioner.lookup.StatusExtractor;

import java.util.List;

/**
 * Binds one resource kind to its remote control plane.
 * <p>
 * Implementations translate typed requests into remote calls; they do not wait. Waiting and
 * error classification belong to {@link LifecycleOrchestrator}.
 *
 * @param <S> snapshot type
 * @param <C> create specification type
 * @param <U> change set type
 */
public interface ManagedResource<S, C, U extends ChangeSet> extends ResourceFinder<S> {
    
    /**
     * Kind name used in logs, metrics and errors, e.g. {@code cluster-endpoint}.
     */
    String kind();
    
    ResourceIdentifierCodec identifierCodec();
    
    AbsenceRules absenceRules();
    
    StatusExtractor<S> statusExtractor();
    
    /**
     * Issues the remote create call.
     *
     * @return the key parts of the created object, in identifier order
     */
    List<String> create(C spec);
    
    /**
     * Issues the remote modify call for the object addressed by the decoded identifier.
     */
    void modify(List<String> idParts, U changes);
    
    /**
     * Issues the remote delete call for the object addressed by the decoded identifier.
     */
    void delete(List<String> idParts);
}
