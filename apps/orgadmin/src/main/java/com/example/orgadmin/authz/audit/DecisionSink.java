package com.example.orgadmin.authz.audit;

/**
 * Consumer of recorded decisions, called off the request path.
 */
public interface DecisionSink {

    void accept(DecisionEvent event);
}
