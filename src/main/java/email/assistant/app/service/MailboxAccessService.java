package email.assistant.app.service;

import email.assistant.app.entity.User;

public interface MailboxAccessService {

    /**
     * @throws MailboxAccessException when the user has no usable token or the client cannot be built
     */
    MailboxClient open(User user);
}
