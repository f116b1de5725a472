/**
 * Core of the RDS broker.
 *
 * <p>Two subsystems live here:
 *
 * <ul>
 *   <li>Resource lifecycle: {@link com.example.rdsbroker.core.instances.InstanceLifecycleManager},
 *       {@link com.example.rdsbroker.core.versions.VersionResolver}, {@link
 *       com.example.rdsbroker.core.tags.TagStore} and {@link
 *       com.example.rdsbroker.core.snapshots.SnapshotRetentionManager} drive the RDS control
 *       plane.
 *   <li>Access control: {@link com.example.rdsbroker.core.engines.EngineDriver} implementations
 *       mint credentials through {@link com.example.rdsbroker.core.credentials.CredentialVault}
 *       and apply privileges compiled by {@link
 *       com.example.rdsbroker.core.privileges.PrivilegeCompiler}.
 * </ul>
 *
 * <p>All failures surface as subclasses of {@link com.example.rdsbroker.core.errors.BrokerException}.
 */
package com.example.rdsbroker.core;
