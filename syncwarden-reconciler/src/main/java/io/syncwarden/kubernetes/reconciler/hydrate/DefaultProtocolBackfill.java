/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.hydrate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import io.syncwarden.kubernetes.reconciler.ResourcesUtil;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Fills in {@code protocol: TCP} on every port that omits it, for the workload kinds that carry a pod spec and for
 * services. The API server defaults the protocol, so without this a manifest that leaves it out would never
 * compare equal to what is read back from the cluster.
 */
class DefaultProtocolBackfill {

    static final String DEFAULT_PROTOCOL = "TCP";
    private static final String PROTOCOL = "protocol";

    private static final List<String> POD = List.of("spec");
    private static final List<String> POD_TEMPLATE = List.of("spec", "template", "spec");
    private static final List<String> CRON_JOB_POD_TEMPLATE = List.of("spec", "jobTemplate", "spec", "template", "spec");
    private static final List<String> SERVICE_PORTS = List.of("spec", "ports");

    private DefaultProtocolBackfill() {
    }

    /**
     * Backfills the object in place.
     *
     * @param resource a generic object
     * @return problems found with the object's structure, empty if the object was well formed
     */
    static List<String> apply(GenericKubernetesResource resource) {
        Map<String, Object> root = resource.getAdditionalProperties();
        String group = ResourcesUtil.group(resource);
        String kind = String.valueOf(resource.getKind());
        var errors = new ArrayList<String>();
        switch (group + "/" + kind) {
            case "/Pod" -> backfillPodSpecAt(root, POD, errors);
            case "apps/DaemonSet", "apps/Deployment", "apps/ReplicaSet", "apps/StatefulSet", "batch/Job", "/ReplicationController" ->
                backfillPodSpecAt(root, POD_TEMPLATE, errors);
            case "batch/CronJob" -> backfillPodSpecAt(root, CRON_JOB_POD_TEMPLATE, errors);
            case "/Service" -> backfillPortsAt(root, SERVICE_PORTS, errors);
            default -> {
                // other kinds carry no ports
            }
        }
        return errors;
    }

    private static void backfillPodSpecAt(Map<String, Object> root, List<String> fields, List<String> errors) {
        Object podSpec = nested(root, fields);
        if (podSpec == null) {
            errors.add(dotted(fields) + " is required");
            return;
        }
        if (!(podSpec instanceof Map<?, ?> podSpecMap)) {
            errors.add(typeError(fields, podSpec, "a map"));
            return;
        }
        Object initContainers = podSpecMap.get("initContainers");
        if (initContainers != null) {
            backfillContainers(initContainers, fields, "initContainers", errors);
        }
        Object containers = podSpecMap.get("containers");
        if (containers != null) {
            backfillContainers(containers, fields, "containers", errors);
        }
    }

    private static void backfillContainers(Object containers, List<String> podSpecFields, String field, List<String> errors) {
        if (!(containers instanceof List<?> containerList)) {
            errors.add(dotted(podSpecFields) + "." + field + " accessor error: " + containers + " is of the type "
                    + containers.getClass().getSimpleName() + ", expected a list");
            return;
        }
        for (Object container : containerList) {
            if (container instanceof Map<?, ?> containerMap) {
                backfillPortsAt(containerMap, List.of("ports"), errors);
            }
            else {
                errors.add("container must be a map");
            }
        }
    }

    private static void backfillPortsAt(Map<?, ?> owner, List<String> fields, List<String> errors) {
        Object ports = nested(owner, fields);
        if (ports == null) {
            return;
        }
        if (!(ports instanceof List<?> portList)) {
            errors.add(typeError(fields, ports, "a list"));
            return;
        }
        for (Object port : portList) {
            if (port instanceof Map<?, ?> portMap) {
                if (!portMap.containsKey(PROTOCOL)) {
                    putProtocol(portMap);
                }
            }
            else {
                errors.add("port must be a map");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void putProtocol(Map<?, ?> port) {
        ((Map<String, Object>) port).put(PROTOCOL, DEFAULT_PROTOCOL);
    }

    @Nullable
    private static Object nested(Map<?, ?> root, List<String> fields) {
        Object current = root;
        for (String field : fields) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(field);
        }
        return current;
    }

    private static String dotted(List<String> fields) {
        return "." + String.join(".", fields);
    }

    private static String typeError(List<String> fields, Object value, String expected) {
        return dotted(fields) + " accessor error: " + value + " is of the type " + value.getClass().getSimpleName() + ", expected " + expected;
    }
}
