package alpha.lapis.events;

/**
 * Non-blocking implementation of {@link EventHub}.<p>
 *
 * The behavior of this class is documented in {@link EventEmitter}.
 */
public class DefaultEventHub extends AbstractEventEmitter implements EventHub
{
    @Override
    public int dispatch(Object event) {
        return emit(event, null, null);
    }

    @Override
    public int dispatch(Object event, Object attachment) {
        return emit(event, attachment, null);
    }

    @Override
    public int dispatch(Object event, Object att1, Object att2) {
        return emit(event, att1, att2);
    }
}
