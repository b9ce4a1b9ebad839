/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Policy Control Compiler
 */

package com.acme.grc.graph;

import com.acme.grc.model.EvidenceConfig;
import com.acme.grc.model.EvidenceSchema;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the external control graph. Every operation may legitimately return nothing; implementations
 * must be safe to call from several threads at once.
 */
public interface ControlGraphReader {

    /** Outgoing control-link edges of a control config. */
    List<String> linkedControls(String controlConfigId) throws GraphReadException;

    /** Evidence configs attached directly to a control config. */
    List<EvidenceConfig> evidenceConfigs(String controlConfigId) throws GraphReadException;

    /** The schema of an evidence config, empty when none is registered. */
    Optional<EvidenceSchema> schemaFor(String evidenceConfigId) throws GraphReadException;
}
