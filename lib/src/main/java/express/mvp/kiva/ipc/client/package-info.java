/**
 * A blocking client for Kiva IPC servers, for tools and tests.
 */
package express.mvp.kiva.ipc.client;
