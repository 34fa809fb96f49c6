/**
 * Domain layer: authorization engine, mutation guard, ports and domain services.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on infrastructure, api or config packages
 *   <li>Domain contains pure business logic with no framework dependencies
 *   <li>Store and cache are reached only through {@code store.ResourceStore} and {@code
 *       cache.PermissionCache}
 * </ul>
 */
package com.agentverse.authz.domain;
