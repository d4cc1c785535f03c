/** Bounded error history and the statistics computed from it. */
package express.mvp.resilience.history;
