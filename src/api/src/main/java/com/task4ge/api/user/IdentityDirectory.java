package com.task4ge.api.user;

/**
 * User profiles held by the external identity provider.
 */
public interface IdentityDirectory {

  IdentityUser getUser(String userId);

  void setUserPicture(String userId, String pictureUrl);
}
