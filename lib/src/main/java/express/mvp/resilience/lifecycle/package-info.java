/**
 * Background maintenance of the resilience core.
 *
 * <h2>Sweeps</h2>
 *
 * <ol>
 *   <li><b>History pruning:</b> drops errors past the retention period
 *   <li><b>Breaker reconciliation:</b> promotes open breakers whose probe time has passed
 * </ol>
 *
 * @see express.mvp.resilience.lifecycle.MaintenanceScheduler
 */
package express.mvp.resilience.lifecycle;
