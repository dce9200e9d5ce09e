/**
 * Events are any type of objects emitted by an {@link
 * alpha.lapis.events.EventEmitter EventEmitter} and observed by a listener
 * (functional interface). The {@link alpha.lapis.events.EventHub EventHub} of
 * the server receives all events emitted by the server's dispatcher and
 * accept loop.<p>
 *
 * Listeners are grouped by event runtime type. There is no common "Event"
 * supertype; each event is an enum singleton and any event data is passed as
 * attachments.
 */
package alpha.lapis.events;
