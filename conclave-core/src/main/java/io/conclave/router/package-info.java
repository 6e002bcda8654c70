/**
 * Role-based routing over the message bus.
 *
 * <table>
 *   <caption>Publish permissions</caption>
 *   <tr><th>Exchange</th><th>Publisher</th><th>Routing key</th></tr>
 *   <tr><td>{@code agent.activities}</td><td>any role</td><td>{@code <role>.activity.<type>}</td></tr>
 *   <tr><td>{@code code.changes}</td><td>any role</td><td>{@code <role>.code.<type>}</td></tr>
 *   <tr><td>{@code protocol.updates}</td><td>governor</td><td>{@code protocol.<type>}</td></tr>
 *   <tr><td>{@code governance.reviews}</td><td>auditor</td><td>{@code governance.<type>}</td></tr>
 *   <tr><td>{@code feature.insights}</td><td>insights</td><td>{@code feature.<type>}</td></tr>
 * </table>
 */
package io.conclave.router;
