// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

/** Verdict of an {@link ErrorClassifier} for one failure. */
public enum Classification {

    /** Retrying is pointless or harmful: surface the failure on first occurrence. */
    ABORT_IMMEDIATELY,

    /** Keep retrying while the budget lasts and surface the failure only once it is exhausted. */
    RETRY_THEN_SURFACE
}
